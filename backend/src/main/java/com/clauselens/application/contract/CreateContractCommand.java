package com.clauselens.application.contract;

public record CreateContractCommand(
        String orgId,
        String filename,
        String name,
        boolean template,
        String templateType,
        String text
) {}
