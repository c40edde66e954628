package com.clauselens.domain.comparison.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ClauseComparisonStatus {
    IDENTICAL,
    MINOR_CHANGE,
    SIGNIFICANT_CHANGE,
    MISSING,
    ADDED;

    public boolean isChange() {
        return this == MINOR_CHANGE || this == SIGNIFICANT_CHANGE;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
