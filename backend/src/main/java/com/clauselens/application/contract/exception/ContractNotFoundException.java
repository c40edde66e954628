package com.clauselens.application.contract.exception;

public class ContractNotFoundException extends RuntimeException {
    public ContractNotFoundException(String contractId) {
        super("Contract not found: " + contractId);
    }
}
