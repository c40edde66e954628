package com.clauselens.application.comparison.exception;

public class ComparisonNotFoundException extends RuntimeException {
    public ComparisonNotFoundException(String comparisonId) {
        super("Comparison not found: " + comparisonId);
    }
}
