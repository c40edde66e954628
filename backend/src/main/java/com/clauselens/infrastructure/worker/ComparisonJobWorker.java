package com.clauselens.infrastructure.worker;

import com.clauselens.domain.comparison.event.ComparisonRequestedEvent;
import com.clauselens.domain.comparison.model.Comparison;
import com.clauselens.domain.comparison.model.ComparisonStatus;
import com.clauselens.domain.comparison.repository.ComparisonRepository;
import com.clauselens.infrastructure.analysis.pipeline.ComparisonLeaseManager;
import com.clauselens.infrastructure.analysis.pipeline.ComparisonPipeline;
import com.clauselens.infrastructure.analysis.pipeline.ComparisonResultRecorder;
import com.clauselens.infrastructure.analysis.pipeline.LeaseLostException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Background executor of comparison runs. Processing rows in the comparisons table are the queue:
 * new rows are dispatched right after their creating transaction commits, and rows whose lease
 * expired (crash, restart, full queue) are picked up again by the recovery sweep.
 */
@Slf4j
@Component
public class ComparisonJobWorker {

    static final String MAX_ATTEMPTS_MESSAGE = "Comparison processing exceeded the maximum number of attempts";

    private final ComparisonRepository comparisonRepository;
    private final ComparisonLeaseManager leaseManager;
    private final ComparisonPipeline pipeline;
    private final ComparisonResultRecorder resultRecorder;
    private final Executor comparisonExecutor;
    private final int maxAttempts;
    private final int recoveryBatchSize;
    private final String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    public ComparisonJobWorker(ComparisonRepository comparisonRepository,
                               ComparisonLeaseManager leaseManager,
                               ComparisonPipeline pipeline,
                               ComparisonResultRecorder resultRecorder,
                               @Qualifier("comparisonExecutor") Executor comparisonExecutor,
                               @Value("${comparison.worker.max-attempts:3}") int maxAttempts,
                               @Value("${comparison.worker.recovery-batch-size:20}") int recoveryBatchSize) {
        this.comparisonRepository = comparisonRepository;
        this.leaseManager = leaseManager;
        this.pipeline = pipeline;
        this.resultRecorder = resultRecorder;
        this.comparisonExecutor = comparisonExecutor;
        this.maxAttempts = maxAttempts;
        this.recoveryBatchSize = recoveryBatchSize;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onComparisonRequested(ComparisonRequestedEvent event) {
        dispatch(event.comparisonId());
    }

    @Scheduled(fixedDelayString = "${comparison.worker.recovery-interval-ms:30000}",
            initialDelayString = "${comparison.worker.recovery-initial-delay-ms:10000}")
    public void recoverAbandonedRuns() {
        List<String> claimable = comparisonRepository.findClaimableIds(
                ComparisonStatus.PROCESSING, LocalDateTime.now(), PageRequest.of(0, recoveryBatchSize));
        if (claimable.isEmpty()) {
            return;
        }
        log.info("[Worker] Recovery sweep found {} unowned processing comparisons", claimable.size());
        claimable.forEach(this::dispatch);
    }

    /**
     * Claims the comparison and hands it to the run pool.
     *
     * @return false when another worker owns it or the pool rejected the run
     */
    public boolean dispatch(String comparisonId) {
        if (!leaseManager.claim(comparisonId, workerId)) {
            log.debug("[Worker] Comparison {} already claimed or no longer processing", comparisonId);
            return false;
        }
        try {
            comparisonExecutor.execute(() -> process(comparisonId));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("[Worker] Run pool is full, comparison {} left for the recovery sweep", comparisonId);
            leaseManager.release(comparisonId, workerId);
            return false;
        }
    }

    void process(String comparisonId) {
        try {
            Comparison comparison = comparisonRepository.findById(comparisonId).orElse(null);
            if (comparison == null) {
                log.info("[Worker] Comparison {} was deleted before its run started", comparisonId);
                return;
            }
            if (comparison.getAttempts() > maxAttempts) {
                log.warn("[Worker] Comparison {} claimed {} times, giving up", comparisonId, comparison.getAttempts());
                resultRecorder.fail(comparisonId, workerId, MAX_ATTEMPTS_MESSAGE, List.of());
                return;
            }
            log.info("[Worker] {} running comparison {} (attempt {})", workerId, comparisonId, comparison.getAttempts());
            pipeline.run(comparisonId, workerId);
        } catch (LeaseLostException e) {
            log.warn("[Worker] {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Worker] Run of comparison {} aborted, lease left to expire", comparisonId, e);
        }
    }

    public String getWorkerId() {
        return workerId;
    }
}
