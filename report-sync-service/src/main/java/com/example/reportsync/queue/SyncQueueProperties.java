package com.example.reportsync.queue;

import lombok.Builder;

import java.time.Duration;

@Builder
public record SyncQueueProperties(
        Duration processInterval,
        int maxConcurrent,
        int maxAttempts,
        long[] retryDelaysMs
) {

    public long retryDelayMs(int attempt) {
        if (retryDelaysMs.length == 0) {
            return 0;
        }
        return retryDelaysMs[Math.min(attempt - 1, retryDelaysMs.length - 1)];
    }
}
