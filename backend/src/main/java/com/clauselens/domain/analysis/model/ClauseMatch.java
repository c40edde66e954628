package com.clauselens.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One source-to-target pairing. A null {@code targetClauseId} means the source has no counterpart.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClauseMatch(
        String sourceClauseId,
        String targetClauseId,
        double matchConfidence,
        String matchReason
) {}
