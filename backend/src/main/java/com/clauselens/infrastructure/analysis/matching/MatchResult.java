package com.clauselens.infrastructure.analysis.matching;

import java.util.List;

/**
 * Reconciled clause pairing. Every source id appears either in a pair or in
 * {@code unmatchedSource}, every target id either in a pair or in {@code unmatchedTarget}.
 */
public record MatchResult(
        List<MatchedPair> matches,
        List<String> unmatchedSource,
        List<String> unmatchedTarget,
        boolean semanticMatchingUsed
) {

    public record MatchedPair(String sourceClauseId, String targetClauseId, double confidence, String reason) {}
}
