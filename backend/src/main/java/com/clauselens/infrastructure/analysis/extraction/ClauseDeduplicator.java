package com.clauselens.infrastructure.analysis.extraction;

import com.clauselens.domain.analysis.model.ExtractedClause;
import com.clauselens.domain.contract.model.ClauseType;
import com.clauselens.infrastructure.analysis.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Removes duplicate and near-duplicate extraction candidates.
 *
 * Candidates are visited by descending confidence so the best extraction of a provision wins.
 * A candidate is dropped when its fingerprint opens with the same 200 characters as one already
 * kept, or when a clause of the same type was kept and both share the first 300 characters.
 * Distinct clauses of one type survive as long as their openings differ.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClauseDeduplicator {

    static final int FINGERPRINT_LENGTH = 500;
    static final int PREFIX_LENGTH = 200;
    static final int SAME_TYPE_OVERLAP_LENGTH = 300;

    private final TextNormalizer textNormalizer;

    public List<ExtractedClause> deduplicate(List<ExtractedClause> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        List<Integer> order = IntStream.range(0, candidates.size()).boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> candidates.get(i).confidenceOrZero())
                        .reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .toList();

        List<ExtractedClause> kept = new ArrayList<>();
        List<String> keptFingerprints = new ArrayList<>();
        Map<ClauseType, String> firstFingerprintByType = new HashMap<>();

        for (int index : order) {
            ExtractedClause candidate = candidates.get(index);
            if (candidate.content() == null || candidate.content().isBlank()) {
                continue;
            }
            String fingerprint = truncate(textNormalizer.fingerprint(candidate.content()), FINGERPRINT_LENGTH);

            if (isDuplicate(candidate.clauseType(), fingerprint, keptFingerprints, firstFingerprintByType)) {
                log.debug("[Dedup] Dropping duplicate {} clause '{}'", candidate.clauseType().code(), candidate.title());
                continue;
            }

            kept.add(candidate);
            keptFingerprints.add(fingerprint);
            firstFingerprintByType.putIfAbsent(candidate.clauseType(), fingerprint);
        }

        kept.sort(Comparator.comparing(c -> c.clauseType().code()));

        if (kept.size() < candidates.size()) {
            log.info("[Dedup] Kept {} of {} extracted clauses", kept.size(), candidates.size());
        }
        return kept;
    }

    private boolean isDuplicate(ClauseType type, String fingerprint,
                                List<String> keptFingerprints, Map<ClauseType, String> firstFingerprintByType) {
        String prefix = truncate(fingerprint, PREFIX_LENGTH);
        for (String seen : keptFingerprints) {
            if (truncate(seen, PREFIX_LENGTH).equals(prefix)) {
                return true;
            }
        }

        String sameType = firstFingerprintByType.get(type);
        return sameType != null
                && truncate(sameType, SAME_TYPE_OVERLAP_LENGTH).equals(truncate(fingerprint, SAME_TYPE_OVERLAP_LENGTH));
    }

    private static String truncate(String text, int length) {
        return text.length() <= length ? text : text.substring(0, length);
    }
}
