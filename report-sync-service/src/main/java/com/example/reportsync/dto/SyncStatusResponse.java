package com.example.reportsync.dto;

import com.example.reportsync.model.SyncMode;
import lombok.Builder;

/**
 * Sync summary shown on the integration card of the admin UI.
 */
@Builder
public record SyncStatusResponse(
        SyncMode syncMode,
        int unsyncedCount,
        int queueLength,
        boolean processing
) {}
