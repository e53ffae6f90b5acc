package com.example.reportsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the sync queue.
 *
 * CRITICAL: the worker pool is bounded. Without it every queued sync would get its own thread.
 *
 * Production Safety:
 * - Core pool: 3 threads (one per concurrent queue slot)
 * - Queue: 100 tasks (bounded queue prevents memory exhaustion)
 * - Rejection: AbortPolicy, the queue keeps a rejected task and retries it on a later tick
 * - Scheduler: single thread, so queue ticks are strictly sequential
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "syncTaskExecutor")
    public ThreadPoolTaskExecutor syncTaskExecutor(
            @Value("${sync.async.core-pool-size:3}") int corePoolSize,
            @Value("${sync.async.max-pool-size:5}") int maxPoolSize,
            @Value("${sync.async.queue-capacity:100}") int queueCapacity,
            @Value("${sync.async.thread-name-prefix:report-sync-}") String threadNamePrefix) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // AbortPolicy = throw RejectedExecutionException if the pool is saturated (handled by SyncQueue)
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // In-flight GitHub calls finish on shutdown instead of leaving reports half-synced
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.setTaskDecorator(new MdcTaskDecorator("QUEUE-"));
        executor.initialize();

        log.info("✅ Initialized syncTaskExecutor - core={}, max={}, queue={}, prefix='{}'",
                corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);
        return executor;
    }

    @Bean(name = "syncQueueScheduler")
    public ThreadPoolTaskScheduler syncQueueScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("sync-queue-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);
        scheduler.initialize();
        return scheduler;
    }
}
