package com.clauselens.infrastructure.analysis.diff;

import com.clauselens.domain.comparison.model.ClauseComparisonStatus;

/**
 * Mechanical change verdict for a matched clause pair.
 *
 * @param status           identical, minor_change or significant_change
 * @param changeRatio      inserted+deleted characters over all diffed characters
 * @param sourceNormalized normalized source text, passed on to risk analysis
 * @param targetNormalized normalized target text, passed on to risk analysis
 */
public record DiffClassification(
        ClauseComparisonStatus status,
        double changeRatio,
        String sourceNormalized,
        String targetNormalized
) {
    public boolean changed() {
        return status.isChange();
    }
}
