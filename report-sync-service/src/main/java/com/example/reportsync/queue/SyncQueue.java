package com.example.reportsync.queue;

import com.example.reportsync.dto.SyncQueueStatusDto;
import com.example.reportsync.dto.SyncResultDto;
import com.example.reportsync.metrics.SyncMetrics;
import com.example.reportsync.model.SyncErrorCode;
import com.example.reportsync.store.ReportStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory retry queue for report syncs.
 *
 * CRITICAL DESIGN:
 * - At most one task per report (enqueue is a no-op for a queued report)
 * - Ticks never overlap: a tick that finds the previous one running is skipped
 * - Each tick runs up to maxConcurrent due tasks in parallel; one task failing never affects the others
 * - Not durable: tasks are lost on restart, reports stay in "pending" and can be re-queued
 *
 * Built by SyncQueueConfig; tests construct their own instances with a fixed clock and a direct executor.
 */
@Slf4j
public class SyncQueue {

    private final SyncTaskHandler handler;
    private final ReportStore reportStore;
    private final Executor executor;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final SyncMetrics syncMetrics;
    private final SyncQueueProperties properties;

    private final Object lock = new Object();
    private final List<SyncTask> tasks = new ArrayList<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private ScheduledFuture<?> timer;

    public SyncQueue(SyncTaskHandler handler,
                     ReportStore reportStore,
                     Executor executor,
                     TaskScheduler scheduler,
                     Clock clock,
                     SyncMetrics syncMetrics,
                     SyncQueueProperties properties) {
        this.handler = handler;
        this.reportStore = reportStore;
        this.executor = executor;
        this.scheduler = scheduler;
        this.clock = clock;
        this.syncMetrics = syncMetrics;
        this.properties = properties;
        syncMetrics.registerQueueDepth(this::size);
    }

    /**
     * Queue a report for sync and mark it pending.
     *
     * @return false when the report was already queued
     */
    public boolean enqueue(String reportId, String integrationId) {
        synchronized (lock) {
            boolean queued = tasks.stream().anyMatch(t -> t.getReportId().equals(reportId));
            if (queued) {
                log.debug("Report already in sync queue: reportId={}", reportId);
                return false;
            }
            tasks.add(new SyncTask(reportId, integrationId, clock.instant()));
        }

        try {
            reportStore.markPending(reportId);
        } catch (RuntimeException e) {
            log.warn("Queued reportId={} but could not mark it pending: {}", reportId, e.getMessage());
        }
        syncMetrics.recordEnqueued();
        log.info("Added report to sync queue: reportId={}, integrationId={}", reportId, integrationId);
        return true;
    }

    /**
     * Run one tick: pick the due tasks and wait for all of them.
     */
    public void processQueue() {
        if (!processing.compareAndSet(false, true)) {
            log.debug("Previous sync queue tick still running, skipping");
            return;
        }
        MDC.put("correlationId", "QUEUE-" + UUID.randomUUID().toString().substring(0, 8));

        try {
            List<SyncTask> ready;
            synchronized (lock) {
                Instant now = clock.instant();
                ready = tasks.stream()
                        .filter(t -> t.isDue(now))
                        .limit(properties.maxConcurrent())
                        .collect(Collectors.toList());
            }
            if (ready.isEmpty()) {
                return;
            }
            log.debug("Processing {} sync tasks", ready.size());

            List<CompletableFuture<Boolean>> futures = new ArrayList<>();
            for (SyncTask task : ready) {
                try {
                    futures.add(CompletableFuture.supplyAsync(() -> runTask(task), executor));
                } catch (RejectedExecutionException e) {
                    // Task stays queued untouched and is picked up by a later tick
                    syncMetrics.recordSyncRejection();
                }
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .exceptionally(ex -> {
                        log.error("Error waiting for sync tasks: {}", ex.getMessage());
                        return null;
                    })
                    .join();

            long succeeded = futures.stream().filter(f -> Boolean.TRUE.equals(f.getNow(false))).count();
            log.info("Sync queue batch completed: succeeded={}, failed={}, remaining={}",
                    succeeded, futures.size() - succeeded, size());
        } finally {
            processing.set(false);
            MDC.remove("correlationId");
        }
    }

    private boolean runTask(SyncTask task) {
        int attempt;
        synchronized (lock) {
            attempt = task.recordAttempt();
        }

        SyncResultDto result;
        try {
            result = handler.sync(task.getReportId(), task.getIntegrationId());
        } catch (Exception e) {
            log.error("Sync task for reportId={} threw: {}", task.getReportId(), e.getMessage(), e);
            result = SyncResultDto.failed(task.getReportId(), SyncErrorCode.SYNC_FAILED, e.getMessage());
        }

        if (result.isSuccess()) {
            removeTask(task);
            log.info("Sync task completed: reportId={}", task.getReportId());
            return true;
        }

        if (!result.isRetryable() || attempt >= properties.maxAttempts()) {
            removeTask(task);
            syncMetrics.recordDropped();
            log.error("Sync task failed permanently: reportId={}, attempts={}, code={}, error={}",
                    task.getReportId(), attempt, result.getErrorCode(), result.getErrorMessage());
            return false;
        }

        long delay = properties.retryDelayMs(attempt);
        synchronized (lock) {
            task.rescheduleAt(clock.instant().plusMillis(delay));
        }
        log.warn("Sync task failed, scheduling retry: reportId={}, attempt={}, nextAttemptIn={}ms",
                task.getReportId(), attempt, delay);
        return false;
    }

    private void removeTask(SyncTask task) {
        synchronized (lock) {
            tasks.remove(task);
        }
    }

    public void start() {
        synchronized (lock) {
            if (timer != null) {
                return;
            }
            timer = scheduler.scheduleAtFixedRate(this::processQueue, properties.processInterval());
        }
        log.info("Sync queue processor started: interval={}ms, maxConcurrent={}, maxAttempts={}",
                properties.processInterval().toMillis(), properties.maxConcurrent(), properties.maxAttempts());
    }

    /**
     * Stop ticking. A tick already running finishes its tasks.
     */
    public void stop() {
        synchronized (lock) {
            if (timer == null) {
                return;
            }
            timer.cancel(false);
            timer = null;
        }
        log.info("Sync queue processor stopped");
    }

    public SyncQueueStatusDto getStatus() {
        synchronized (lock) {
            List<SyncQueueStatusDto.TaskView> views = tasks.stream()
                    .map(t -> new SyncQueueStatusDto.TaskView(t.getReportId(), t.getAttempts(), t.getNextAttempt()))
                    .collect(Collectors.toList());
            return SyncQueueStatusDto.builder()
                    .queueLength(views.size())
                    .processing(processing.get())
                    .tasks(views)
                    .build();
        }
    }

    public boolean remove(String reportId) {
        synchronized (lock) {
            return tasks.removeIf(t -> t.getReportId().equals(reportId));
        }
    }

    public void clear() {
        synchronized (lock) {
            tasks.clear();
        }
        log.info("Sync queue cleared");
    }

    public int size() {
        synchronized (lock) {
            return tasks.size();
        }
    }

    public boolean isProcessing() {
        return processing.get();
    }
}
