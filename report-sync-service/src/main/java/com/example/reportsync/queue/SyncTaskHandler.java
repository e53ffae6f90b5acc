package com.example.reportsync.queue;

import com.example.reportsync.dto.SyncResultDto;

/**
 * Performs one sync attempt for a queued task.
 */
@FunctionalInterface
public interface SyncTaskHandler {

    SyncResultDto sync(String reportId, String integrationId);
}
