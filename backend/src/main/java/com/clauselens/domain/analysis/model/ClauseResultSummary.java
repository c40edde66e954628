package com.clauselens.domain.analysis.model;

import com.clauselens.domain.comparison.model.ClauseComparisonStatus;
import com.clauselens.domain.contract.model.ClauseType;

/**
 * Per-clause outcome handed to the summary call.
 */
public record ClauseResultSummary(
        ClauseType clauseType,
        ClauseComparisonStatus status,
        Integer riskScore,
        String summary
) {}
