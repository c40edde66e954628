package com.clauselens.application.contract.exception;

public class ContractInUseException extends RuntimeException {
    public ContractInUseException(String contractId) {
        super("Contract " + contractId + " is referenced by a comparison and cannot be deleted");
    }
}
