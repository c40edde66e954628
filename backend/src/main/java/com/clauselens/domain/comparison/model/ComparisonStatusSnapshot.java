package com.clauselens.domain.comparison.model;

import com.clauselens.domain.comparison.repository.ComparisonStatusView;

import java.time.LocalDateTime;

/**
 * Status of one comparison as reported by the point query and the status stream.
 */
public record ComparisonStatusSnapshot(
        String id,
        String name,
        ComparisonStatus status,
        Integer overallRiskScore,
        String errorMessage,
        LocalDateTime createdAt,
        LocalDateTime completedAt
) {
    public static ComparisonStatusSnapshot from(ComparisonStatusView view) {
        return new ComparisonStatusSnapshot(view.getId(), view.getName(), view.getStatus(),
                view.getOverallRiskScore(), view.getErrorMessage(), view.getCreatedAt(), view.getCompletedAt());
    }
}
