package com.clauselens.domain.contract.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IngestionStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
