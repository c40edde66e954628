package com.clauselens.interfaces.api.dto;

import com.clauselens.application.comparison.ComparisonDetail;

import java.util.List;

public record ComparisonDetailResponse(
        ComparisonResponse comparison,
        ContractResponse sourceContract,
        ContractResponse targetContract,
        List<ClauseResponse> sourceClauses,
        List<ClauseResponse> targetClauses,
        List<ClauseComparisonResponse> clauseComparisons
) {
    public static ComparisonDetailResponse from(ComparisonDetail detail) {
        return new ComparisonDetailResponse(
                ComparisonResponse.from(detail.comparison(), detail.sourceContract(), detail.targetContract()),
                ContractResponse.from(detail.sourceContract()),
                ContractResponse.from(detail.targetContract()),
                detail.sourceClauses().stream().map(ClauseResponse::from).toList(),
                detail.targetClauses().stream().map(ClauseResponse::from).toList(),
                detail.clauseComparisons().stream().map(ClauseComparisonResponse::from).toList());
    }
}
