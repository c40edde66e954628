package com.clauselens.interfaces.api.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Either the two texts or the two contract ids.
 */
public record CreateComparisonRequest(
        @Size(max = 500_000, message = "Contract text must be less than 500000 characters")
        String sourceText,

        @Size(max = 500_000, message = "Contract text must be less than 500000 characters")
        String targetText,

        @Size(max = 200, message = "Name must not exceed 200 characters")
        String sourceName,

        @Size(max = 200, message = "Name must not exceed 200 characters")
        String targetName,

        @Size(max = 255, message = "Filename must not exceed 255 characters")
        String sourceFilename,

        @Size(max = 255, message = "Filename must not exceed 255 characters")
        String targetFilename,

        @Pattern(regexp = UUID_PATTERN, message = "Invalid source contract ID")
        String sourceContractId,

        @Pattern(regexp = UUID_PATTERN, message = "Invalid target contract ID")
        String targetContractId,

        @Pattern(regexp = "template_vs_redline|version_comparison", message = "Unknown comparison type")
        String comparisonType,

        @Size(max = 200, message = "Name must not exceed 200 characters")
        String name,

        @Size(max = 100, message = "Organization id must not exceed 100 characters")
        String orgId
) {
    static final String UUID_PATTERN = "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";
}
