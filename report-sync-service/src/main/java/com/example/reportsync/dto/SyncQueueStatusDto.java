package com.example.reportsync.dto;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
public record SyncQueueStatusDto(
        int queueLength,
        boolean processing,
        List<TaskView> tasks
) {

    public record TaskView(String reportId, int attempts, Instant nextAttempt) {}
}
