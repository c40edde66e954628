package com.clauselens.domain.analysis.model;

import com.clauselens.domain.contract.model.ClauseType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Clause candidate as returned by the extraction call, before deduplication.
 *
 * @param clauseType  vocabulary type, {@link ClauseType#UNKNOWN} when unrecognised
 * @param title       heading as it appears in the document (nullable)
 * @param content     full clause text
 * @param pageNumber  page, when identifiable (nullable)
 * @param confidence  extraction confidence 0-1 (nullable)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedClause(
        @JsonProperty("clause_type") ClauseType clauseType,
        @JsonProperty("title") String title,
        @JsonProperty("content") String content,
        @JsonProperty("page_number") Integer pageNumber,
        @JsonProperty("confidence") Double confidence
) {
    public ExtractedClause {
        if (clauseType == null) {
            clauseType = ClauseType.UNKNOWN;
        }
    }

    public double confidenceOrZero() {
        return confidence != null ? confidence : 0.0;
    }
}
