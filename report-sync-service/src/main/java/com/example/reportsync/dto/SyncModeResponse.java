package com.example.reportsync.dto;

import com.example.reportsync.model.SyncMode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncModeResponse(
        SyncMode syncMode,
        boolean changed,
        Integer unsyncedCount,
        String message
) {}
