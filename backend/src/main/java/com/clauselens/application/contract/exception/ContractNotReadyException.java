package com.clauselens.application.contract.exception;

public class ContractNotReadyException extends RuntimeException {
    public ContractNotReadyException() {
        super("Both contracts must be processed before comparison");
    }
}
