package com.clauselens.domain.analysis.service;

/**
 * Any failure of the external reasoning backend: transport, rate limit, or an unusable reply.
 */
public class ReasoningServiceException extends RuntimeException {

    public ReasoningServiceException(String message) {
        super(message);
    }

    public ReasoningServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
