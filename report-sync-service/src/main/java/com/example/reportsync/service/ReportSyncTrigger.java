package com.example.reportsync.service;

import com.example.reportsync.entity.Integration;
import com.example.reportsync.queue.SyncQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Queues changed reports of projects that have automatic sync enabled.
 * Never throws back into the publisher: a failed trigger must not fail the report write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReportSyncTrigger {

    private final SyncOrchestrator syncOrchestrator;
    private final SyncQueue syncQueue;

    @EventListener
    public void onReportChanged(ReportChangedEvent event) {
        try {
            Optional<Integration> integration = syncOrchestrator.getAutoSyncIntegration(event.projectId());
            if (integration.isEmpty()) {
                return;
            }
            boolean queued = syncQueue.enqueue(event.reportId(), integration.get().getId());
            log.debug("Report {} reportId={} queued={} for integrationId={}",
                    event.change(), event.reportId(), queued, integration.get().getId());
        } catch (RuntimeException e) {
            log.error("Failed to queue auto-sync for reportId={}: {}", event.reportId(), e.getMessage(), e);
        }
    }
}
