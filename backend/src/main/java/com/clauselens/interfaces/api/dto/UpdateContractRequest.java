package com.clauselens.interfaces.api.dto;

import jakarta.validation.constraints.Size;

public record UpdateContractRequest(
        @Size(max = 200, message = "Name must not exceed 200 characters")
        String name,

        Boolean isTemplate,

        @Size(max = 50, message = "Template type must not exceed 50 characters")
        String templateType
) {}
