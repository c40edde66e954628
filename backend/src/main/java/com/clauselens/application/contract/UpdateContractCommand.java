package com.clauselens.application.contract;

/**
 * Null fields are left unchanged.
 */
public record UpdateContractCommand(String name, Boolean template, String templateType) {}
