package com.clauselens.infrastructure.analysis.pipeline;

import com.clauselens.domain.comparison.model.ComparisonStatus;
import com.clauselens.domain.comparison.repository.ComparisonRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Time-bounded ownership of a processing comparison. Only the lease holder may write results.
 */
@Slf4j
@Component
public class ComparisonLeaseManager {

    private final ComparisonRepository comparisonRepository;
    private final long leaseSeconds;

    public ComparisonLeaseManager(ComparisonRepository comparisonRepository,
                                  @Value("${comparison.worker.lease-seconds:600}") long leaseSeconds) {
        this.comparisonRepository = comparisonRepository;
        this.leaseSeconds = leaseSeconds;
    }

    // Called from after-commit listeners, so it needs a transaction of its own
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean claim(String comparisonId, String owner) {
        LocalDateTime now = LocalDateTime.now();
        boolean claimed = comparisonRepository.claim(comparisonId, owner, ComparisonStatus.PROCESSING,
                now, now.plusSeconds(leaseSeconds)) == 1;
        if (claimed) {
            log.debug("[Lease] {} claimed comparison {}", owner, comparisonId);
        }
        return claimed;
    }

    /**
     * @throws LeaseLostException when {@code owner} no longer holds the lease
     */
    public void renew(String comparisonId, String owner) {
        int updated = comparisonRepository.renewLease(comparisonId, owner, ComparisonStatus.PROCESSING,
                LocalDateTime.now().plusSeconds(leaseSeconds));
        if (updated == 0) {
            throw new LeaseLostException(comparisonId);
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void release(String comparisonId, String owner) {
        comparisonRepository.releaseLease(comparisonId, owner);
    }
}
