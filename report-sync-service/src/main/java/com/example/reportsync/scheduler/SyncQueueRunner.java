package com.example.reportsync.scheduler;

import com.example.reportsync.queue.SyncQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the sync queue ticking once the application is ready.
 *
 * Can be disabled via report-sync.queue.enabled=false, e.g. on a replica that only serves
 * webhooks. Tasks are still accepted then, they just wait for a manual processQueue().
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "report-sync.queue.enabled", havingValue = "true", matchIfMissing = true)
public class SyncQueueRunner {

    private final SyncQueue syncQueue;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        syncQueue.start();
    }

    @EventListener(ContextClosedEvent.class)
    public void stop() {
        log.info("Application shutting down, stopping sync queue");
        syncQueue.stop();
    }
}
