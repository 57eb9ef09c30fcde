package com.kotsin.predictive.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * AsyncConfig - Thread pool for the per-metric analytics fan-out.
 *
 * Trend, anomaly and forecast work for different metrics is independent, so the
 * orchestrator submits one task per metric to {@code analyticsExecutor} and joins them.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    /**
     * Fixed-size pool sized by analytics.execution.parallelism.
     *
     * Uses CallerRunsPolicy: if the queue is full the submitting thread runs the task,
     * so no metric is ever dropped for lack of capacity.
     */
    @Bean(name = "analyticsExecutor")
    public Executor analyticsExecutor(AnalyticsConfig config) {
        AnalyticsConfig.Execution execution = config.getExecution();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(execution.getParallelism());
        executor.setMaxPoolSize(execution.getParallelism());
        executor.setQueueCapacity(execution.getQueueCapacity());
        executor.setThreadNamePrefix("analytics-");

        executor.setRejectedExecutionHandler((Runnable r, ThreadPoolExecutor e) -> {
            log.warn("[ANALYTICS-EXECUTOR] Queue full, executing in caller thread. activeCount={}, queueSize={}",
                    e.getActiveCount(), e.getQueue().size());
            if (!e.isShutdown()) {
                r.run();
            }
        });

        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("[ANALYTICS-EXECUTOR] Initialized: poolSize={}, queueCapacity={}",
                execution.getParallelism(), execution.getQueueCapacity());
        return executor;
    }
}
