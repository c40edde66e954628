package com.clauselens.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Raw semantic matching verdict. It may be incomplete or inconsistent and is repaired
 * by the clause matcher before use.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClauseMatchingResult(
        List<ClauseMatch> matches,
        List<String> unmatchedSource,
        List<String> unmatchedTarget
) {
    public ClauseMatchingResult {
        matches = matches != null ? matches : List.of();
        unmatchedSource = unmatchedSource != null ? unmatchedSource : List.of();
        unmatchedTarget = unmatchedTarget != null ? unmatchedTarget : List.of();
    }
}
