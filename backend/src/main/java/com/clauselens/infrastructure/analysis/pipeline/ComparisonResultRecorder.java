package com.clauselens.infrastructure.analysis.pipeline;

import com.clauselens.domain.comparison.event.ComparisonStatusChangedEvent;
import com.clauselens.domain.comparison.model.ClauseComparison;
import com.clauselens.domain.comparison.model.Comparison;
import com.clauselens.domain.comparison.repository.ClauseComparisonRepository;
import com.clauselens.domain.comparison.repository.ComparisonRepository;
import com.clauselens.domain.contract.model.Contract;
import com.clauselens.domain.contract.repository.ContractRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Writes the terminal state of a run. Clause comparison rows and the status change commit together,
 * and only while the caller still holds the lease.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComparisonResultRecorder {

    private final ComparisonRepository comparisonRepository;
    private final ClauseComparisonRepository clauseComparisonRepository;
    private final ContractRepository contractRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public void complete(String comparisonId, String leaseOwner, List<ClauseComparison> rows,
                         int overallRiskScore, String summary, List<String> semanticTags) {
        Comparison comparison = lockOwned(comparisonId, leaseOwner);

        clauseComparisonRepository.saveAll(rows);
        comparison.complete(overallRiskScore, summary, semanticTags);

        eventPublisher.publishEvent(new ComparisonStatusChangedEvent(
                comparison.getId(), comparison.getOrgId(), comparison.getStatus()));
    }

    /**
     * Fails the comparison, and the given contracts whose extraction did not finish.
     */
    @Transactional
    public void fail(String comparisonId, String leaseOwner, String errorMessage, Collection<String> contractIds) {
        Comparison comparison = lockOwned(comparisonId, leaseOwner);

        comparison.fail(errorMessage);
        if (!contractIds.isEmpty()) {
            contractRepository.findAllById(contractIds).forEach(Contract::markFailed);
        }

        eventPublisher.publishEvent(new ComparisonStatusChangedEvent(
                comparison.getId(), comparison.getOrgId(), comparison.getStatus()));
    }

    private Comparison lockOwned(String comparisonId, String leaseOwner) {
        Comparison comparison = comparisonRepository.findByIdForUpdate(comparisonId)
                .orElseThrow(() -> new LeaseLostException(comparisonId));
        if (!comparison.isProcessing() || !comparison.isLeasedBy(leaseOwner)) {
            throw new LeaseLostException(comparisonId);
        }
        return comparison;
    }
}
