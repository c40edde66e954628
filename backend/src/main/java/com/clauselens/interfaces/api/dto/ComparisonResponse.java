package com.clauselens.interfaces.api.dto;

import com.clauselens.application.comparison.ComparisonOverview;
import com.clauselens.domain.comparison.model.Comparison;
import com.clauselens.domain.comparison.model.ComparisonStatus;
import com.clauselens.domain.comparison.model.ComparisonType;
import com.clauselens.domain.contract.model.Contract;

import java.time.LocalDateTime;
import java.util.List;

public record ComparisonResponse(
        String id,
        String orgId,
        String name,
        ComparisonType comparisonType,
        ComparisonStatus status,
        Integer overallRiskScore,
        String summary,
        List<String> semanticTags,
        String errorMessage,
        LocalDateTime createdAt,
        LocalDateTime completedAt,
        ContractRef sourceContract,
        ContractRef targetContract
) {

    public record ContractRef(String id, String name, String filename) {
        static ContractRef from(Contract contract) {
            return contract == null ? null : new ContractRef(contract.getId(), contract.getName(), contract.getFilename());
        }
    }

    public static ComparisonResponse from(ComparisonOverview overview) {
        return from(overview.comparison(), overview.sourceContract(), overview.targetContract());
    }

    public static ComparisonResponse from(Comparison comparison, Contract source, Contract target) {
        return new ComparisonResponse(comparison.getId(), comparison.getOrgId(), comparison.getName(),
                comparison.getComparisonType(), comparison.getStatus(), comparison.getOverallRiskScore(),
                comparison.getSummary(), comparison.getSemanticTags(), comparison.getErrorMessage(),
                comparison.getCreatedAt(), comparison.getCompletedAt(),
                ContractRef.from(source), ContractRef.from(target));
    }
}
