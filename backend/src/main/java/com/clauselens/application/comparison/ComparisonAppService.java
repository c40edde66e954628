package com.clauselens.application.comparison;

import com.clauselens.application.comparison.exception.ComparisonNotFoundException;
import com.clauselens.application.comparison.exception.InvalidComparisonRequestException;
import com.clauselens.application.contract.exception.ContractNotFoundException;
import com.clauselens.application.contract.exception.ContractNotReadyException;
import com.clauselens.domain.comparison.event.ComparisonRequestedEvent;
import com.clauselens.domain.comparison.model.ClauseComparison;
import com.clauselens.domain.comparison.model.Comparison;
import com.clauselens.domain.comparison.model.ComparisonStatusSnapshot;
import com.clauselens.domain.comparison.model.ComparisonType;
import com.clauselens.domain.comparison.repository.ClauseComparisonRepository;
import com.clauselens.domain.comparison.repository.ComparisonRepository;
import com.clauselens.domain.contract.model.Clause;
import com.clauselens.domain.contract.model.Contract;
import com.clauselens.domain.contract.repository.ClauseRepository;
import com.clauselens.domain.contract.repository.ContractRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.clauselens.application.common.InputSanitizer.sanitize;
import static com.clauselens.application.common.InputSanitizer.sanitizeOptional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ComparisonAppService {

    static final String DEFAULT_SOURCE_NAME = "Original";
    static final String DEFAULT_TARGET_NAME = "Revised";
    static final String DEFAULT_SOURCE_FILENAME = "Original.txt";
    static final String DEFAULT_TARGET_FILENAME = "Revised.txt";
    static final String DEFAULT_TEMPLATE_TYPE = "general";

    private final ComparisonRepository comparisonRepository;
    private final ClauseComparisonRepository clauseComparisonRepository;
    private final ContractRepository contractRepository;
    private final ClauseRepository clauseRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${comparison.default-org-id:demo-org}")
    private String defaultOrgId;

    /**
     * Validates the request, writes the comparison in processing and schedules its run once the
     * transaction commits. Nothing is written when validation fails.
     */
    @Transactional
    public ComparisonOverview create(CreateComparisonCommand command) {
        String orgId = resolveOrgId(command.orgId());
        ComparisonType comparisonType = parseComparisonType(command.comparisonType());
        String name = sanitizeOptional(command.name());

        ComparisonOverview created;
        if (command.hasTexts()) {
            created = createFromTexts(command, orgId, name, comparisonType);
        } else if (command.hasContractIds()) {
            created = createFromContracts(command, orgId, name, comparisonType);
        } else {
            throw new InvalidComparisonRequestException(
                    "Either provide sourceText/targetText or sourceContractId/targetContractId");
        }

        eventPublisher.publishEvent(new ComparisonRequestedEvent(created.comparison().getId()));
        log.info("[Comparison] Created {} - orgId: {}, source: {}, target: {}", created.comparison().getId(), orgId,
                created.sourceContract().getId(), created.targetContract().getId());
        return created;
    }

    private ComparisonOverview createFromTexts(CreateComparisonCommand command, String orgId, String name,
                                               ComparisonType comparisonType) {
        String sourceText = sanitize(command.sourceText());
        String targetText = sanitize(command.targetText());
        if (sourceText.isEmpty() || targetText.isEmpty()) {
            throw new InvalidComparisonRequestException("Source and target contract text are required");
        }

        Contract source = contractRepository.save(Contract.builder()
                .orgId(orgId)
                .name(orDefault(sanitizeOptional(command.sourceName()), DEFAULT_SOURCE_NAME))
                .filename(orDefault(sanitizeOptional(command.sourceFilename()), DEFAULT_SOURCE_FILENAME))
                .rawText(sourceText)
                .template(true)
                .templateType(DEFAULT_TEMPLATE_TYPE)
                .build());
        Contract target = contractRepository.save(Contract.builder()
                .orgId(orgId)
                .name(orDefault(sanitizeOptional(command.targetName()), DEFAULT_TARGET_NAME))
                .filename(orDefault(sanitizeOptional(command.targetFilename()), DEFAULT_TARGET_FILENAME))
                .rawText(targetText)
                .template(false)
                .build());

        Comparison comparison = comparisonRepository.save(Comparison.builder()
                .orgId(orgId)
                .name(name)
                .sourceContractId(source.getId())
                .targetContractId(target.getId())
                .comparisonType(comparisonType)
                .build());
        return new ComparisonOverview(comparison, source, target);
    }

    private ComparisonOverview createFromContracts(CreateComparisonCommand command, String orgId, String name,
                                                   ComparisonType comparisonType) {
        Contract source = contractRepository.findById(command.sourceContractId().trim())
                .orElseThrow(() -> new ContractNotFoundException(command.sourceContractId()));
        Contract target = contractRepository.findById(command.targetContractId().trim())
                .orElseThrow(() -> new ContractNotFoundException(command.targetContractId()));
        if (!source.isCompleted() || !target.isCompleted()) {
            throw new ContractNotReadyException();
        }

        Comparison comparison = comparisonRepository.save(Comparison.builder()
                .orgId(orgId)
                .name(name)
                .sourceContractId(source.getId())
                .targetContractId(target.getId())
                .comparisonType(comparisonType)
                .build());
        return new ComparisonOverview(comparison, source, target);
    }

    @Transactional(readOnly = true)
    public List<ComparisonOverview> list(String orgId) {
        List<Comparison> comparisons = comparisonRepository.findByOrgIdOrderByCreatedAtDesc(resolveOrgId(orgId));
        List<String> contractIds = comparisons.stream()
                .flatMap(c -> Stream.of(c.getSourceContractId(), c.getTargetContractId()))
                .distinct()
                .toList();
        Map<String, Contract> contracts = contractRepository.findAllById(contractIds).stream()
                .collect(Collectors.toMap(Contract::getId, Function.identity()));
        return comparisons.stream()
                .map(c -> new ComparisonOverview(c,
                        contracts.get(c.getSourceContractId()), contracts.get(c.getTargetContractId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public ComparisonDetail getDetail(String comparisonId) {
        Comparison comparison = findComparison(comparisonId);
        Contract source = contractRepository.findById(comparison.getSourceContractId()).orElse(null);
        Contract target = contractRepository.findById(comparison.getTargetContractId()).orElse(null);

        List<Clause> sourceClauses = clauseRepository.findByContractId(comparison.getSourceContractId());
        List<Clause> targetClauses = clauseRepository.findByContractId(comparison.getTargetContractId());
        List<ClauseComparison> clauseComparisons = comparison.isProcessing()
                ? List.of()
                : clauseComparisonRepository.findByComparisonIdOrderByClauseType(comparisonId);

        return new ComparisonDetail(comparison, source, target, sourceClauses, targetClauses, clauseComparisons);
    }

    @Transactional(readOnly = true)
    public ComparisonStatusSnapshot getStatus(String comparisonId) {
        return comparisonRepository.findStatusViewById(comparisonId)
                .map(ComparisonStatusSnapshot::from)
                .orElseThrow(() -> new ComparisonNotFoundException(comparisonId));
    }

    @Transactional
    public Comparison rename(String comparisonId, String name) {
        Comparison comparison = findComparison(comparisonId);
        comparison.rename(sanitizeOptional(name));
        return comparison;
    }

    /**
     * Deleting a processing comparison makes its run lose the lease; the run then stops without writing.
     */
    @Transactional
    public void delete(String comparisonId) {
        Comparison comparison = findComparison(comparisonId);
        clauseComparisonRepository.deleteByComparisonId(comparisonId);
        comparisonRepository.deleteById(comparison.getId());
        log.info("[Comparison] Deleted {}", comparisonId);
    }

    public String resolveOrgId(String orgId) {
        String cleaned = sanitizeOptional(orgId);
        return cleaned != null ? cleaned : defaultOrgId;
    }

    private Comparison findComparison(String comparisonId) {
        return comparisonRepository.findById(comparisonId)
                .orElseThrow(() -> new ComparisonNotFoundException(comparisonId));
    }

    private static ComparisonType parseComparisonType(String code) {
        try {
            return ComparisonType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new InvalidComparisonRequestException("Unknown comparison type: " + code);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
