package com.clauselens.infrastructure.analysis.pipeline;

import com.clauselens.domain.analysis.model.ClauseResultSummary;
import com.clauselens.domain.analysis.model.ExtractedClause;
import com.clauselens.domain.analysis.model.RiskAnalysis;
import com.clauselens.domain.analysis.service.ClauseReasoningService;
import com.clauselens.domain.comparison.model.ClauseComparison;
import com.clauselens.domain.comparison.model.ClauseComparisonStatus;
import com.clauselens.domain.comparison.model.Comparison;
import com.clauselens.domain.comparison.repository.ComparisonRepository;
import com.clauselens.domain.contract.model.Clause;
import com.clauselens.domain.contract.model.ClauseType;
import com.clauselens.domain.contract.model.Contract;
import com.clauselens.domain.contract.repository.ClauseRepository;
import com.clauselens.domain.contract.repository.ContractRepository;
import com.clauselens.infrastructure.analysis.diff.DiffClassification;
import com.clauselens.infrastructure.analysis.diff.DiffClassifier;
import com.clauselens.infrastructure.analysis.extraction.ClauseExtractor;
import com.clauselens.infrastructure.analysis.matching.ClauseMatcher;
import com.clauselens.infrastructure.analysis.matching.MatchResult;
import com.clauselens.infrastructure.analysis.matching.MatchResult.MatchedPair;
import com.clauselens.infrastructure.analysis.risk.RiskAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One orchestration run of a comparison:
 * extraction, matching, diff classification, risk analysis, aggregation, summary and tags,
 * then a single terminal write.
 *
 * The run owns its comparison through a lease. The lease is renewed between stages and the
 * run stops without writing as soon as it is lost.
 */
@Slf4j
@Component
public class ComparisonPipeline {

    static final int MINOR_CHANGE_FALLBACK_SCORE = 25;
    static final int SIGNIFICANT_CHANGE_FALLBACK_SCORE = 60;
    static final String UNKNOWN_ERROR = "Unknown error occurred";

    private final ComparisonRepository comparisonRepository;
    private final ContractRepository contractRepository;
    private final ClauseRepository clauseRepository;
    private final ClauseExtractor clauseExtractor;
    private final ContractClauseWriter clauseWriter;
    private final ClauseMatcher clauseMatcher;
    private final DiffClassifier diffClassifier;
    private final RiskAggregator riskAggregator;
    private final ClauseReasoningService reasoningService;
    private final ComparisonResultRecorder resultRecorder;
    private final ComparisonLeaseManager leaseManager;
    private final Executor analysisExecutor;

    public ComparisonPipeline(ComparisonRepository comparisonRepository,
                              ContractRepository contractRepository,
                              ClauseRepository clauseRepository,
                              ClauseExtractor clauseExtractor,
                              ContractClauseWriter clauseWriter,
                              ClauseMatcher clauseMatcher,
                              DiffClassifier diffClassifier,
                              RiskAggregator riskAggregator,
                              ClauseReasoningService reasoningService,
                              ComparisonResultRecorder resultRecorder,
                              ComparisonLeaseManager leaseManager,
                              @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.comparisonRepository = comparisonRepository;
        this.contractRepository = contractRepository;
        this.clauseRepository = clauseRepository;
        this.clauseExtractor = clauseExtractor;
        this.clauseWriter = clauseWriter;
        this.clauseMatcher = clauseMatcher;
        this.diffClassifier = diffClassifier;
        this.riskAggregator = riskAggregator;
        this.reasoningService = reasoningService;
        this.resultRecorder = resultRecorder;
        this.leaseManager = leaseManager;
        this.analysisExecutor = analysisExecutor;
    }

    private record ContractClauses(Contract source, Contract target, List<Clause> sourceClauses, List<Clause> targetClauses) {}

    public void run(String comparisonId, String leaseOwner) {
        Comparison comparison = comparisonRepository.findById(comparisonId).orElse(null);
        if (comparison == null || !comparison.isProcessing()) {
            log.info("[Pipeline] Comparison {} is no longer processing, skipping run", comparisonId);
            return;
        }

        long start = System.currentTimeMillis();
        Set<String> extracting = new LinkedHashSet<>();
        boolean extractionCompleted = false;
        try {
            ContractClauses clauses = extractClauses(comparison, extracting);
            extractionCompleted = true;
            leaseManager.renew(comparisonId, leaseOwner);

            MatchResult matchResult = clauseMatcher.match(clauses.sourceClauses(), clauses.targetClauses());
            log.info("[Pipeline] Comparison {} matched {} pairs, {} missing, {} added (semantic={})",
                    comparisonId, matchResult.matches().size(), matchResult.unmatchedSource().size(),
                    matchResult.unmatchedTarget().size(), matchResult.semanticMatchingUsed());
            leaseManager.renew(comparisonId, leaseOwner);

            List<ClauseOutcome> outcomes = classify(matchResult, clauses);
            leaseManager.renew(comparisonId, leaseOwner);

            int overallRiskScore = riskAggregator.aggregate(outcomes.stream().map(ClauseOutcome::riskScore).toList());

            List<ClauseResultSummary> results = outcomes.stream().map(ClauseOutcome::toSummary).toList();
            List<ClauseType> clauseTypes = outcomes.stream().map(ClauseOutcome::clauseType).distinct().toList();
            String sourceLabel = clauses.source().getName();
            String targetLabel = clauses.target().getName();

            CompletableFuture<String> summaryFuture = CompletableFuture.supplyAsync(() ->
                    generateSummary(comparisonId, sourceLabel, targetLabel, results), analysisExecutor);
            CompletableFuture<List<String>> tagsFuture = CompletableFuture.supplyAsync(() ->
                    generateTags(comparisonId, sourceLabel, targetLabel, clauseTypes, overallRiskScore), analysisExecutor);
            CompletableFuture.allOf(summaryFuture, tagsFuture).join();

            List<ClauseComparison> rows = outcomes.stream().map(o -> o.toEntity(comparisonId)).toList();
            resultRecorder.complete(comparisonId, leaseOwner, rows, overallRiskScore, summaryFuture.join(), tagsFuture.join());

            log.info("[Pipeline] Comparison {} completed - clauses: {}, overallRisk: {}, duration: {}ms",
                    comparisonId, rows.size(), overallRiskScore, System.currentTimeMillis() - start);
        } catch (LeaseLostException e) {
            log.warn("[Pipeline] Comparison {} lost its lease, abandoning run without writing", comparisonId);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            log.error("[Pipeline] Comparison {} failed after {}ms", comparisonId, System.currentTimeMillis() - start, cause);
            recordFailure(comparisonId, leaseOwner, cause, extractionCompleted ? List.of() : extracting);
        }
    }

    private ContractClauses extractClauses(Comparison comparison, Set<String> extracting) {
        Contract source = loadContract(comparison.getSourceContractId());
        Contract target = loadContract(comparison.getTargetContractId());

        Map<String, CompletableFuture<List<ExtractedClause>>> pending = new LinkedHashMap<>();
        for (Contract contract : List.of(source, target)) {
            if (contract.isCompleted() || pending.containsKey(contract.getId())) {
                continue;
            }
            String rawText = contract.getRawText();
            if (rawText == null || rawText.isBlank()) {
                throw new IllegalStateException("Contract " + contract.getName() + " has no text to extract clauses from");
            }
            extracting.add(contract.getId());
            clauseWriter.markProcessing(contract.getId(), null);
            pending.put(contract.getId(),
                    CompletableFuture.supplyAsync(() -> clauseExtractor.extract(rawText), analysisExecutor));
        }

        if (!pending.isEmpty()) {
            log.info("[Pipeline] Comparison {} extracting clauses of {} contract(s)", comparison.getId(), pending.size());
            CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();
            pending.forEach((contractId, future) -> clauseWriter.replaceClauses(contractId, future.join()));
        }

        return new ContractClauses(source, target,
                clauseRepository.findByContractId(source.getId()),
                clauseRepository.findByContractId(target.getId()));
    }

    private List<ClauseOutcome> classify(MatchResult matchResult, ContractClauses clauses) {
        Map<String, Clause> sourceById = clauses.sourceClauses().stream()
                .collect(Collectors.toMap(Clause::getId, Function.identity()));
        Map<String, Clause> targetById = clauses.targetClauses().stream()
                .collect(Collectors.toMap(Clause::getId, Function.identity()));

        List<CompletableFuture<ClauseOutcome>> futures = new ArrayList<>();
        int analysed = 0;
        for (MatchedPair pair : matchResult.matches()) {
            Clause source = sourceById.get(pair.sourceClauseId());
            Clause target = targetById.get(pair.targetClauseId());
            DiffClassification diff = diffClassifier.classify(source.getContent(), target.getContent());
            if (!diff.changed()) {
                futures.add(CompletableFuture.completedFuture(
                        ClauseOutcome.identical(source.getClauseType(), source.getId(), target.getId())));
            } else {
                futures.add(CompletableFuture.supplyAsync(() -> analyseRisk(source, target, diff), analysisExecutor));
                analysed++;
            }
        }
        for (String sourceId : matchResult.unmatchedSource()) {
            futures.add(CompletableFuture.completedFuture(
                    ClauseOutcome.missing(sourceById.get(sourceId).getClauseType(), sourceId)));
        }
        for (String targetId : matchResult.unmatchedTarget()) {
            futures.add(CompletableFuture.completedFuture(
                    ClauseOutcome.added(targetById.get(targetId).getClauseType(), targetId)));
        }

        if (analysed > 0) {
            log.info("[Pipeline] Analysing risk of {} changed clauses in parallel", analysed);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        return futures.stream()
                .map(CompletableFuture::join)
                .sorted(Comparator.comparing(o -> o.clauseType().code()))
                .toList();
    }

    /**
     * Risk of one changed pair. A failed analysis falls back to a score fixed by the change status.
     */
    ClauseOutcome analyseRisk(Clause source, Clause target, DiffClassification diff) {
        ClauseType clauseType = source.getClauseType();
        try {
            RiskAnalysis analysis = reasoningService.analyzeClauseRisk(
                    diff.sourceNormalized(), diff.targetNormalized(), clauseType);
            return new ClauseOutcome(clauseType, source.getId(), target.getId(), diff.status(),
                    analysis.riskScore(), analysis.riskFactors(), analysis.deviationPercentage(), analysis.summary());
        } catch (RuntimeException e) {
            log.warn("[Pipeline] Risk analysis failed for {} clause, using fallback score: {}",
                    clauseType.code(), e.getMessage());
            int fallbackScore = diff.status() == ClauseComparisonStatus.MINOR_CHANGE
                    ? MINOR_CHANGE_FALLBACK_SCORE : SIGNIFICANT_CHANGE_FALLBACK_SCORE;
            double deviation = Math.round(diff.changeRatio() * 1000) / 10.0;
            return new ClauseOutcome(clauseType, source.getId(), target.getId(), diff.status(),
                    fallbackScore, List.of(), deviation, "Changes detected in " + clauseType.code() + " clause.");
        }
    }

    private String generateSummary(String comparisonId, String sourceLabel, String targetLabel,
                                   List<ClauseResultSummary> results) {
        try {
            return reasoningService.generateComparisonSummary(sourceLabel, targetLabel, results);
        } catch (RuntimeException e) {
            log.warn("[Pipeline] Comparison {} summary generation failed: {}", comparisonId, e.getMessage());
            return null;
        }
    }

    private List<String> generateTags(String comparisonId, String sourceLabel, String targetLabel,
                                      List<ClauseType> clauseTypes, int overallRiskScore) {
        try {
            return reasoningService.generateSemanticTags(sourceLabel, targetLabel, clauseTypes, overallRiskScore);
        } catch (RuntimeException e) {
            log.warn("[Pipeline] Comparison {} tag generation failed: {}", comparisonId, e.getMessage());
            return null;
        }
    }

    private void recordFailure(String comparisonId, String leaseOwner, Throwable cause, Collection<String> contractIds) {
        String message = Objects.requireNonNullElse(cause.getMessage(), UNKNOWN_ERROR);
        try {
            resultRecorder.fail(comparisonId, leaseOwner, message, contractIds);
        } catch (LeaseLostException e) {
            log.warn("[Pipeline] Comparison {} lost its lease before the failure could be recorded", comparisonId);
        }
    }

    private Contract loadContract(String contractId) {
        return contractRepository.findById(contractId)
                .orElseThrow(() -> new IllegalStateException("Contract " + contractId + " not found"));
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
