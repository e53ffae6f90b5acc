package com.example.reportsync.config;

import com.example.reportsync.metrics.SyncMetrics;
import com.example.reportsync.queue.SyncQueue;
import com.example.reportsync.queue.SyncQueueProperties;
import com.example.reportsync.service.Sleeper;
import com.example.reportsync.service.SyncOrchestrator;
import com.example.reportsync.store.ReportStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the sync queue and the time sources of the sync engine.
 * The queue is always available for enqueueing; SyncQueueRunner decides whether it ticks.
 */
@Configuration
public class SyncQueueConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public SyncQueueProperties syncQueueProperties(
            @Value("${report-sync.queue.process-interval-ms:5000}") long processIntervalMs,
            @Value("${report-sync.queue.max-concurrent:3}") int maxConcurrent,
            @Value("${report-sync.queue.max-attempts:3}") int maxAttempts,
            @Value("${report-sync.queue.retry-delays-ms:1000,5000,15000}") long[] retryDelaysMs) {
        return SyncQueueProperties.builder()
                .processInterval(Duration.ofMillis(processIntervalMs))
                .maxConcurrent(maxConcurrent)
                .maxAttempts(maxAttempts)
                .retryDelaysMs(retryDelaysMs)
                .build();
    }

    @Bean(destroyMethod = "stop")
    public SyncQueue syncQueue(SyncOrchestrator syncOrchestrator,
                               ReportStore reportStore,
                               @Qualifier("syncTaskExecutor") ThreadPoolTaskExecutor syncTaskExecutor,
                               @Qualifier("syncQueueScheduler") ThreadPoolTaskScheduler syncQueueScheduler,
                               Clock clock,
                               SyncMetrics syncMetrics,
                               SyncQueueProperties syncQueueProperties) {
        return new SyncQueue(syncOrchestrator::syncReport, reportStore, syncTaskExecutor,
                syncQueueScheduler, clock, syncMetrics, syncQueueProperties);
    }
}
