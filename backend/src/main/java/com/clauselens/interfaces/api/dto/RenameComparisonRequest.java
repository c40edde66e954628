package com.clauselens.interfaces.api.dto;

import jakarta.validation.constraints.Size;

public record RenameComparisonRequest(
        @Size(max = 200, message = "Name must not exceed 200 characters")
        String name
) {}
