package com.kotsin.fairvalue.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * AsyncConfig - Thread pool for per-expiration analysis.
 *
 * Max pain and gamma walls for different expirations are independent, so the
 * aggregator may fan them out when pfv.expiration.parallel is enabled.
 *
 * Uses CallerRunsPolicy semantics: if the queue is full the caller thread runs the task,
 * so an expiration is never skipped, just analyzed inline.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "expirationAnalysisExecutor")
    public Executor expirationAnalysisExecutor(FairValueConfig config) {
        int poolSize = Math.max(1, config.getExpiration().getPoolSize());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("pfv-expiration-");

        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("[EXPIRATION-EXECUTOR] Queue full, executing in caller thread. activeCount={}, queueSize={}",
                    e.getActiveCount(), e.getQueue().size());
            if (!e.isShutdown()) {
                r.run();
            }
        });

        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("[EXPIRATION-EXECUTOR] Initialized: poolSize={}, parallel={}",
                poolSize, config.getExpiration().isParallel());
        return executor;
    }
}
