package com.clauselens.domain.comparison.event;

/**
 * Published when a new comparison row has been written in {@code processing}.
 */
public record ComparisonRequestedEvent(String comparisonId) {}
