package com.example.reportsync.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - report_sync_total: outcome of single report syncs (success / failure)
 * - report_sync_duration_seconds: duration of single report syncs
 * - sync_queue_enqueued_total / sync_queue_dropped_total: queue intake and permanent failures
 * - sync_queue_depth: current number of queued tasks
 * - sync_tasks_rejected_total: queue tasks rejected by the worker pool (AbortPolicy)
 * - webhook_deliveries_total: inbound webhook deliveries by outcome
 *
 * Access metrics: http://localhost:8084/actuator/prometheus
 */
@Component
@Slf4j
public class SyncMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter syncSuccessCounter;
    private final Counter syncFailureCounter;
    private final Counter queueEnqueuedCounter;
    private final Counter queueDroppedCounter;
    private final Counter syncTasksRejectedCounter;

    private final Timer syncTimer;

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.syncSuccessCounter = Counter.builder("report_sync_total")
                .description("Number of report sync attempts")
                .tag("result", "success")
                .register(meterRegistry);

        this.syncFailureCounter = Counter.builder("report_sync_total")
                .tag("result", "failure")
                .register(meterRegistry);

        this.queueEnqueuedCounter = Counter.builder("sync_queue_enqueued_total")
                .description("Number of tasks accepted by the sync queue")
                .register(meterRegistry);

        this.queueDroppedCounter = Counter.builder("sync_queue_dropped_total")
                .description("Number of tasks dropped after exhausting attempts or failing permanently")
                .register(meterRegistry);

        this.syncTasksRejectedCounter = Counter.builder("sync_tasks_rejected_total")
                .description("Number of queue tasks rejected by the worker pool (AbortPolicy)")
                .register(meterRegistry);

        this.syncTimer = Timer.builder("report_sync_duration_seconds")
                .description("Duration of single report syncs")
                .register(meterRegistry);
    }

    public void recordSyncSuccess(long durationMs) {
        syncSuccessCounter.increment();
        syncTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordSyncFailure(long durationMs) {
        syncFailureCounter.increment();
        syncTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordEnqueued() {
        queueEnqueuedCounter.increment();
    }

    public void recordDropped() {
        queueDroppedCounter.increment();
    }

    /**
     * Record queue task rejection (worker pool saturated).
     * The task stays queued and is picked up again on a later tick.
     */
    public void recordSyncRejection() {
        syncTasksRejectedCounter.increment();
        log.error("❌ Sync task rejected - worker pool saturated");
    }

    /**
     * Record one inbound webhook delivery.
     *
     * @param outcome processed, ignored, ping, unauthorized, invalid, not_found, failed
     */
    public void recordWebhook(String outcome) {
        Counter.builder("webhook_deliveries_total")
                .description("Inbound webhook deliveries by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void registerQueueDepth(Supplier<Number> depth) {
        Gauge.builder("sync_queue_depth", depth)
                .description("Tasks currently held by the sync queue")
                .register(meterRegistry);
    }
}
