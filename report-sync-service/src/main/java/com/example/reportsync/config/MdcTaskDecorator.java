package com.example.reportsync.config;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * TaskDecorator to propagate MDC (correlation ID) from the submitting thread to sync workers.
 *
 * Thread Lifecycle:
 * 1. Queue tick or HTTP thread holds the correlation ID in MDC
 * 2. decorate() runs on that thread and captures a copy of the context
 * 3. Worker thread restores the copy before run(); a submitter without a correlation ID
 *    gets a fresh {@code <prefix><8 hex>} one so every sync log line can be grepped by task
 * 4. finally restores whatever the worker had before (or clears it)
 */
public class MdcTaskDecorator implements TaskDecorator {

    static final String MDC_KEY = "correlationId";

    private final String fallbackPrefix;

    public MdcTaskDecorator(String fallbackPrefix) {
        this.fallbackPrefix = fallbackPrefix;
    }

    @Override
    public Runnable decorate(Runnable runnable) {
        Map<String, String> parentContext = MDC.getCopyOfContextMap();
        Map<String, String> taskContext = parentContext != null ? new HashMap<>(parentContext) : new HashMap<>();
        taskContext.computeIfAbsent(MDC_KEY, k -> fallbackPrefix + UUID.randomUUID().toString().substring(0, 8));

        return () -> {
            Map<String, String> previousContext = MDC.getCopyOfContextMap();
            try {
                MDC.setContextMap(taskContext);
                runnable.run();
            } finally {
                // Pooled threads are reused; never leave a task's correlation ID behind
                if (previousContext != null) {
                    MDC.setContextMap(previousContext);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
