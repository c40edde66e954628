package com.clauselens.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateContractRequest(
        @NotBlank(message = "Filename is required")
        @Size(max = 255, message = "Filename must not exceed 255 characters")
        String filename,

        @Size(max = 200, message = "Name must not exceed 200 characters")
        String name,

        Boolean isTemplate,

        @Size(max = 50, message = "Template type must not exceed 50 characters")
        String templateType,

        @Size(max = 500_000, message = "Contract text must be less than 500000 characters")
        String text,

        @Size(max = 100, message = "Organization id must not exceed 100 characters")
        String orgId
) {}
