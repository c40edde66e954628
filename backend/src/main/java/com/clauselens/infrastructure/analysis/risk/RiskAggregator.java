package com.clauselens.infrastructure.analysis.risk;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Objects;

/**
 * Severity-weighted average of per-clause risk scores.
 * Scores of 75+ weigh 2.0, 50+ weigh 1.5, everything else 1.0, so one critical clause
 * pulls the overall score up more than its share of the count.
 */
@Component
public class RiskAggregator {

    public int aggregate(Collection<Integer> clauseRiskScores) {
        if (clauseRiskScores == null) {
            return 0;
        }
        double weightedSum = 0;
        double totalWeight = 0;
        for (Integer score : clauseRiskScores.stream().filter(Objects::nonNull).toList()) {
            double weight = weightOf(score);
            weightedSum += score * weight;
            totalWeight += weight;
        }
        return totalWeight > 0 ? (int) Math.round(weightedSum / totalWeight) : 0;
    }

    static double weightOf(int score) {
        if (score >= 75) return 2.0;
        if (score >= 50) return 1.5;
        return 1.0;
    }
}
