package com.clauselens.infrastructure.analysis.matching;

import com.clauselens.domain.analysis.model.ClauseForMatching;
import com.clauselens.domain.analysis.model.ClauseMatch;
import com.clauselens.domain.analysis.model.ClauseMatchingResult;
import com.clauselens.domain.analysis.service.ClauseReasoningService;
import com.clauselens.domain.contract.model.Clause;
import com.clauselens.domain.contract.model.ClauseType;
import com.clauselens.infrastructure.analysis.matching.MatchResult.MatchedPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Pairs source clauses with target clauses.
 *
 * Primary strategy is the external semantic matcher. Its verdict is untrusted: entries with
 * unknown or reused ids are dropped, and every source clause it left out is repaired against
 * the still-unmatched targets, first by identical clause type, then by normalized title.
 * When the matcher call fails altogether, clauses are paired by type alone.
 *
 * Both clause lists are processed in (type, id) order; when several targets qualify for a
 * repair the first one in that order wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClauseMatcher {

    public static final double FALLBACK_CONFIDENCE = 0.7;

    private static final Comparator<Clause> CLAUSE_ORDER = Comparator
            .comparing((Clause c) -> c.getClauseType().code())
            .thenComparing(Clause::getId);

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");
    private static final Pattern HEADING_WORDS = Pattern.compile("section|article|clause");

    private final ClauseReasoningService reasoningService;

    public MatchResult match(List<Clause> sourceClauses, List<Clause> targetClauses) {
        List<Clause> source = sourceClauses.stream().sorted(CLAUSE_ORDER).toList();
        List<Clause> target = targetClauses.stream().sorted(CLAUSE_ORDER).toList();

        if (source.isEmpty() || target.isEmpty()) {
            return new MatchResult(List.of(), ids(source), ids(target), false);
        }

        ClauseMatchingResult semantic;
        try {
            semantic = reasoningService.matchClauses(forMatching(source), forMatching(target));
        } catch (RuntimeException e) {
            log.warn("[Matcher] Semantic matching failed, falling back to type-based matching: {}", e.getMessage());
            return matchByType(source, target);
        }
        return repair(source, target, semantic);
    }

    private MatchResult repair(List<Clause> source, List<Clause> target, ClauseMatchingResult semantic) {
        Map<String, Clause> sourceById = index(source);
        Map<String, Clause> targetById = index(target);

        Set<String> matchedSource = new HashSet<>();
        Set<String> matchedTarget = new HashSet<>();
        Set<String> withoutCounterpart = new HashSet<>();
        Map<String, MatchedPair> pairsBySource = new HashMap<>();

        for (ClauseMatch match : semantic.matches()) {
            String sourceId = match.sourceClauseId();
            String targetId = match.targetClauseId();
            if (sourceId == null || !sourceById.containsKey(sourceId)
                    || matchedSource.contains(sourceId) || withoutCounterpart.contains(sourceId)) {
                log.debug("[Matcher] Ignoring match with unknown or reused source id {}", sourceId);
                continue;
            }
            if (targetId == null) {
                withoutCounterpart.add(sourceId);
                continue;
            }
            if (!targetById.containsKey(targetId) || matchedTarget.contains(targetId)) {
                log.debug("[Matcher] Ignoring match with unknown or reused target id {}", targetId);
                continue;
            }
            pairsBySource.put(sourceId, new MatchedPair(sourceId, targetId,
                    clampConfidence(match.matchConfidence()), match.matchReason()));
            matchedSource.add(sourceId);
            matchedTarget.add(targetId);
        }

        int repaired = 0;
        for (Clause sourceClause : source) {
            if (matchedSource.contains(sourceClause.getId()) || withoutCounterpart.contains(sourceClause.getId())) {
                continue;
            }
            Optional<MatchedPair> fallback = findFallback(sourceClause, target, matchedTarget);
            if (fallback.isPresent()) {
                pairsBySource.put(sourceClause.getId(), fallback.get());
                matchedSource.add(sourceClause.getId());
                matchedTarget.add(fallback.get().targetClauseId());
                repaired++;
            }
        }
        if (repaired > 0) {
            log.info("[Matcher] Repaired {} clause matches the semantic matcher left out", repaired);
        }

        List<MatchedPair> pairs = source.stream()
                .map(c -> pairsBySource.get(c.getId()))
                .filter(p -> p != null)
                .toList();
        return new MatchResult(pairs,
                idsWhere(source, c -> !matchedSource.contains(c.getId())),
                idsWhere(target, c -> !matchedTarget.contains(c.getId())),
                true);
    }

    private Optional<MatchedPair> findFallback(Clause sourceClause, List<Clause> target, Set<String> matchedTarget) {
        Optional<Clause> byType = target.stream()
                .filter(t -> !matchedTarget.contains(t.getId()))
                .filter(t -> t.getClauseType() == sourceClause.getClauseType())
                .findFirst();
        if (byType.isPresent()) {
            return byType.map(t -> new MatchedPair(sourceClause.getId(), t.getId(), FALLBACK_CONFIDENCE,
                    "Matched by clause type: " + sourceClause.getClauseType().code()));
        }

        String sourceTitle = normalizeTitle(sourceClause.getTitle());
        if (sourceTitle.isEmpty()) {
            return Optional.empty();
        }
        return target.stream()
                .filter(t -> !matchedTarget.contains(t.getId()))
                .filter(t -> sourceTitle.equals(normalizeTitle(t.getTitle())))
                .findFirst()
                .map(t -> new MatchedPair(sourceClause.getId(), t.getId(), FALLBACK_CONFIDENCE,
                        "Matched by title similarity"));
    }

    /**
     * Pairs clauses of the same type in sorted order; leftovers of a type stay unmatched.
     */
    MatchResult matchByType(List<Clause> source, List<Clause> target) {
        Map<ClauseType, List<Clause>> sourceByType = groupByType(source);
        Map<ClauseType, List<Clause>> targetByType = groupByType(target);

        Set<ClauseType> allTypes = new TreeSet<>(Comparator.comparing(ClauseType::code));
        allTypes.addAll(sourceByType.keySet());
        allTypes.addAll(targetByType.keySet());

        List<MatchedPair> pairs = new ArrayList<>();
        List<String> unmatchedSource = new ArrayList<>();
        List<String> unmatchedTarget = new ArrayList<>();

        for (ClauseType type : allTypes) {
            List<Clause> sourceOfType = sourceByType.getOrDefault(type, List.of());
            List<Clause> targetOfType = targetByType.getOrDefault(type, List.of());
            int paired = Math.min(sourceOfType.size(), targetOfType.size());
            for (int i = 0; i < paired; i++) {
                pairs.add(new MatchedPair(sourceOfType.get(i).getId(), targetOfType.get(i).getId(),
                        FALLBACK_CONFIDENCE, "Matched by clause type: " + type.code()));
            }
            sourceOfType.subList(paired, sourceOfType.size()).forEach(c -> unmatchedSource.add(c.getId()));
            targetOfType.subList(paired, targetOfType.size()).forEach(c -> unmatchedTarget.add(c.getId()));
        }
        return new MatchResult(pairs, unmatchedSource, unmatchedTarget, false);
    }

    /**
     * Lower-cases, keeps only [a-z0-9] and strips the words section/article/clause,
     * so "Section 5" and "5." compare equal.
     */
    static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String compact = NON_ALPHANUMERIC.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("");
        return HEADING_WORDS.matcher(compact).replaceAll("");
    }

    private static List<ClauseForMatching> forMatching(List<Clause> clauses) {
        return clauses.stream()
                .map(c -> new ClauseForMatching(c.getId(), c.getClauseType(),
                        c.getTitle() != null ? c.getTitle() : c.getClauseType().code(), c.getContent()))
                .toList();
    }

    private static Map<ClauseType, List<Clause>> groupByType(List<Clause> clauses) {
        Map<ClauseType, List<Clause>> byType = new LinkedHashMap<>();
        for (Clause clause : clauses) {
            byType.computeIfAbsent(clause.getClauseType(), t -> new ArrayList<>()).add(clause);
        }
        return byType;
    }

    private static Map<String, Clause> index(List<Clause> clauses) {
        Map<String, Clause> byId = new LinkedHashMap<>();
        clauses.forEach(c -> byId.put(c.getId(), c));
        return byId;
    }

    private static double clampConfidence(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static List<String> ids(List<Clause> clauses) {
        return clauses.stream().map(Clause::getId).toList();
    }

    private static List<String> idsWhere(List<Clause> clauses, Predicate<Clause> filter) {
        return clauses.stream().filter(filter).map(Clause::getId).toList();
    }
}
