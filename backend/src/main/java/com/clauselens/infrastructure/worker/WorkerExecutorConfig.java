package com.clauselens.infrastructure.worker;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class WorkerExecutorConfig {

    @Value("${comparison.worker.pool-size:4}")
    private int poolSize;

    @Value("${comparison.worker.queue-capacity:100}")
    private int queueCapacity;

    @Value("${comparison.worker.analysis-pool-size:16}")
    private int analysisPoolSize;

    @Value("${comparison.stream.scheduler-pool-size:4}")
    private int schedulerPoolSize;

    /**
     * Runs whole comparisons. A full queue rejects, the worker then releases the lease
     * and leaves the row to the recovery sweep.
     */
    @Bean
    public ThreadPoolTaskExecutor comparisonExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("comparison-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Fan-out calls inside one run (extraction pair, risk analyses, summary and tags).
     */
    @Bean
    public ThreadPoolTaskExecutor analysisExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analysisPoolSize);
        executor.setMaxPoolSize(analysisPoolSize);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("analysis-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Shared by {@code @Scheduled} jobs and the status stream poll loops.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerPoolSize);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
