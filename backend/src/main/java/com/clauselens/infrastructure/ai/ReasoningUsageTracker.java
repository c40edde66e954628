package com.clauselens.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide token accounting for reasoning calls.
 */
@Slf4j
@Component
public class ReasoningUsageTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();

    public void recordUsage(String operation, long promptTokens, long completionTokens) {
        long requests = totalRequests.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);

        log.info("[Reasoning] {} request #{}: promptTokens={}, completionTokens={}, " +
                        "cumulative: promptTokens={}, completionTokens={}, failureRate={}%",
                operation, requests, promptTokens, completionTokens,
                totalPromptTokens.get(), totalCompletionTokens.get(),
                String.format("%.1f", getFailureRate()));
    }

    /**
     * Counts a failed call. Tokens are those the service reported before the reply proved unusable.
     */
    public void recordFailure(String operation, long promptTokens, long completionTokens) {
        totalRequests.incrementAndGet();
        failedRequests.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);
        log.debug("[Reasoning] {} request failed, failureRate={}%", operation, String.format("%.1f", getFailureRate()));
    }

    public double getFailureRate() {
        long total = totalRequests.get();
        return total > 0 ? (double) failedRequests.get() / total * 100 : 0;
    }
}
