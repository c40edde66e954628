package com.clauselens.interfaces.api.dto;

import com.clauselens.domain.comparison.model.ClauseComparison;
import com.clauselens.domain.comparison.model.ClauseComparisonStatus;
import com.clauselens.domain.contract.model.ClauseType;

import java.util.List;

public record ClauseComparisonResponse(
        String id,
        ClauseType clauseType,
        String sourceClauseId,
        String targetClauseId,
        ClauseComparisonStatus status,
        Integer riskScore,
        List<String> riskFactors,
        Double deviationPercentage,
        String diffSummary
) {
    public static ClauseComparisonResponse from(ClauseComparison row) {
        return new ClauseComparisonResponse(row.getId(), row.getClauseType(), row.getSourceClauseId(),
                row.getTargetClauseId(), row.getStatus(), row.getRiskScore(), row.getRiskFactors(),
                row.getDeviationPercentage(), row.getDiffSummary());
    }
}
