package com.clauselens.application.contract.exception;

public class ContractAlreadyProcessedException extends RuntimeException {
    public ContractAlreadyProcessedException(String contractId) {
        super("Contract " + contractId + " has already been processed and its text can no longer change");
    }
}
