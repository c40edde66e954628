package com.clauselens.application.comparison.exception;

public class InvalidComparisonRequestException extends RuntimeException {
    public InvalidComparisonRequestException(String message) {
        super(message);
    }
}
