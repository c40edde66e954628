package com.clauselens.infrastructure.analysis.extraction;

import com.clauselens.domain.analysis.model.ExtractedClause;
import com.clauselens.domain.analysis.service.ClauseReasoningService;
import com.clauselens.infrastructure.analysis.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Normalizes contract text, asks the reasoning service for clause candidates and drops duplicates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClauseExtractor {

    private final TextNormalizer textNormalizer;
    private final ClauseReasoningService reasoningService;
    private final ClauseDeduplicator deduplicator;

    public List<ExtractedClause> extract(String rawText) {
        String normalized = textNormalizer.normalize(rawText);
        if (normalized == null || normalized.isEmpty()) {
            log.info("[Extraction] Empty contract text, no clauses extracted");
            return List.of();
        }
        List<ExtractedClause> candidates = reasoningService.extractClauses(normalized);
        return deduplicator.deduplicate(candidates);
    }
}
