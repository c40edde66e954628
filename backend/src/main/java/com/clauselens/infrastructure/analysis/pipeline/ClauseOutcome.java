package com.clauselens.infrastructure.analysis.pipeline;

import com.clauselens.domain.analysis.model.ClauseResultSummary;
import com.clauselens.domain.comparison.model.ClauseComparison;
import com.clauselens.domain.comparison.model.ClauseComparisonStatus;
import com.clauselens.domain.contract.model.ClauseType;

import java.util.List;

/**
 * Per-clause result of a run before it is persisted.
 */
record ClauseOutcome(
        ClauseType clauseType,
        String sourceClauseId,
        String targetClauseId,
        ClauseComparisonStatus status,
        Integer riskScore,
        List<String> riskFactors,
        Double deviationPercentage,
        String diffSummary
) {

    static final int UNMATCHED_RISK_SCORE = 50;
    static final String MISSING_SUMMARY = "This clause is missing from the redlined version.";
    static final String ADDED_SUMMARY = "This clause was added in the redlined version.";

    static ClauseOutcome identical(ClauseType clauseType, String sourceClauseId, String targetClauseId) {
        return new ClauseOutcome(clauseType, sourceClauseId, targetClauseId, ClauseComparisonStatus.IDENTICAL,
                0, List.of(), 0.0, null);
    }

    static ClauseOutcome missing(ClauseType clauseType, String sourceClauseId) {
        return new ClauseOutcome(clauseType, sourceClauseId, null, ClauseComparisonStatus.MISSING,
                UNMATCHED_RISK_SCORE, List.of(), null, MISSING_SUMMARY);
    }

    static ClauseOutcome added(ClauseType clauseType, String targetClauseId) {
        return new ClauseOutcome(clauseType, null, targetClauseId, ClauseComparisonStatus.ADDED,
                UNMATCHED_RISK_SCORE, List.of(), null, ADDED_SUMMARY);
    }

    ClauseComparison toEntity(String comparisonId) {
        return ClauseComparison.builder()
                .comparisonId(comparisonId)
                .clauseType(clauseType)
                .sourceClauseId(sourceClauseId)
                .targetClauseId(targetClauseId)
                .status(status)
                .riskScore(riskScore)
                .riskFactors(riskFactors)
                .deviationPercentage(deviationPercentage)
                .diffSummary(diffSummary)
                .build();
    }

    ClauseResultSummary toSummary() {
        return new ClauseResultSummary(clauseType, status, riskScore, diffSummary);
    }
}
