package com.clauselens.infrastructure.analysis.pipeline;

import com.clauselens.domain.analysis.model.ExtractedClause;
import com.clauselens.domain.contract.model.Clause;
import com.clauselens.domain.contract.model.Contract;
import com.clauselens.domain.contract.repository.ClauseRepository;
import com.clauselens.domain.contract.repository.ContractRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Transactional writes of contract ingestion state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContractClauseWriter {

    private final ContractRepository contractRepository;
    private final ClauseRepository clauseRepository;

    @Transactional
    public void markProcessing(String contractId, String text) {
        contractRepository.findById(contractId).ifPresent(contract -> contract.startProcessing(text));
    }

    /**
     * Replaces every clause of the contract with the given batch and marks the contract completed.
     * A contract that another run completed meanwhile keeps its clauses and the batch is dropped.
     */
    @Transactional
    public List<Clause> replaceClauses(String contractId, List<ExtractedClause> extracted) {
        if (loadContract(contractId).isCompleted()) {
            log.info("[Extraction] Contract {} already completed, keeping its stored clauses", contractId);
            return clauseRepository.findByContractId(contractId);
        }
        // Bulk delete clears the persistence context, load the contract again afterwards
        int removed = clauseRepository.deleteByContractId(contractId);
        Contract contract = loadContract(contractId);

        List<Clause> clauses = extracted.stream()
                .map(candidate -> Clause.builder()
                        .contractId(contractId)
                        .clauseType(candidate.clauseType())
                        .title(truncateTitle(candidate.title()))
                        .content(candidate.content())
                        .pageNumber(candidate.pageNumber())
                        .confidenceScore(candidate.confidence())
                        .build())
                .toList();
        List<Clause> saved = clauseRepository.saveAll(clauses);

        contract.markCompleted();
        log.info("[Extraction] Contract {} stored {} clauses, replaced {}", contractId, saved.size(), removed);
        return saved;
    }

    @Transactional
    public void markFailed(Collection<String> contractIds) {
        contractRepository.findAllById(contractIds).forEach(Contract::markFailed);
    }

    private Contract loadContract(String contractId) {
        return contractRepository.findById(contractId)
                .orElseThrow(() -> new IllegalStateException("Contract " + contractId + " disappeared during extraction"));
    }

    static String truncateTitle(String title) {
        if (title == null || title.length() <= Clause.TITLE_MAX_LENGTH) {
            return title;
        }
        return title.substring(0, Clause.TITLE_MAX_LENGTH - 3) + "...";
    }
}
