package com.clauselens.infrastructure.analysis.pipeline;

/**
 * The run no longer owns its comparison: another worker reclaimed the lease or the
 * comparison left {@code processing}.
 */
public class LeaseLostException extends RuntimeException {

    public LeaseLostException(String comparisonId) {
        super("Lease lost for comparison " + comparisonId);
    }
}
