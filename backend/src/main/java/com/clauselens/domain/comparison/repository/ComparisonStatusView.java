package com.clauselens.domain.comparison.repository;

import com.clauselens.domain.comparison.model.ComparisonStatus;

import java.time.LocalDateTime;

/**
 * Status-only projection read by the point query and the status stream.
 */
public interface ComparisonStatusView {

    String getId();

    String getName();

    ComparisonStatus getStatus();

    Integer getOverallRiskScore();

    String getErrorMessage();

    LocalDateTime getCreatedAt();

    LocalDateTime getCompletedAt();
}
