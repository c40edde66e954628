package com.clauselens.interfaces.api.dto;

import com.clauselens.domain.contract.model.Clause;
import com.clauselens.domain.contract.model.ClauseType;

import java.time.LocalDateTime;

public record ClauseResponse(
        String id,
        String contractId,
        ClauseType clauseType,
        String title,
        String content,
        Integer pageNumber,
        Double confidenceScore,
        LocalDateTime extractedAt
) {
    public static ClauseResponse from(Clause clause) {
        return new ClauseResponse(clause.getId(), clause.getContractId(), clause.getClauseType(),
                clause.getTitle(), clause.getContent(), clause.getPageNumber(), clause.getConfidenceScore(),
                clause.getExtractedAt());
    }
}
