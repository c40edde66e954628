package com.clauselens.application.comparison;

/**
 * Either both texts or both contract ids must be present. Texts win when both forms are given.
 */
public record CreateComparisonCommand(
        String orgId,
        String name,
        String comparisonType,
        String sourceText,
        String targetText,
        String sourceName,
        String targetName,
        String sourceFilename,
        String targetFilename,
        String sourceContractId,
        String targetContractId
) {
    public boolean hasTexts() {
        return sourceText != null && !sourceText.isBlank() && targetText != null && !targetText.isBlank();
    }

    public boolean hasContractIds() {
        return sourceContractId != null && !sourceContractId.isBlank()
                && targetContractId != null && !targetContractId.isBlank();
    }
}
