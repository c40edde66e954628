package com.clauselens.interfaces.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Text to extract clauses from; when absent the stored contract text is used.
 */
public record ProcessContractRequest(
        @Size(min = 1, max = 500_000, message = "Contract text must be between 1 and 500000 characters")
        String text
) {}
