package com.clauselens.domain.contract.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Fixed clause vocabulary used by extraction and matching.
 * Anything outside the vocabulary is mapped to {@link #UNKNOWN}.
 */
public enum ClauseType {
    INDEMNIFICATION("indemnification"),
    TERMINATION("termination"),
    IP_OWNERSHIP("ip_ownership"),
    CONFIDENTIALITY("confidentiality"),
    LIMITATION_OF_LIABILITY("limitation_of_liability"),
    GOVERNING_LAW("governing_law"),
    DISPUTE_RESOLUTION("dispute_resolution"),
    ASSIGNMENT("assignment"),
    FORCE_MAJEURE("force_majeure"),
    WARRANTIES("warranties"),
    PAYMENT_TERMS("payment_terms"),
    TERM_AND_RENEWAL("term_and_renewal"),
    NON_COMPETE("non_compete"),
    NON_SOLICITATION("non_solicitation"),
    DATA_PROTECTION("data_protection"),
    UNKNOWN("unknown");

    private final String code;

    ClauseType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ClauseType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        String key = code.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        return Arrays.stream(values())
                .filter(type -> type.code.equals(key))
                .findFirst()
                .orElse(UNKNOWN);
    }

    /**
     * Codes of the known vocabulary, without the unknown fallback.
     */
    public static String vocabulary() {
        return String.join(", ", Arrays.stream(values())
                .filter(type -> type != UNKNOWN)
                .map(ClauseType::code)
                .toList());
    }
}
