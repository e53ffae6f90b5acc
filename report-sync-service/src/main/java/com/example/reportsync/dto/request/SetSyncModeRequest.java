package com.example.reportsync.dto.request;

import com.example.reportsync.model.SyncMode;
import jakarta.validation.constraints.NotNull;

public record SetSyncModeRequest(@NotNull(message = "syncMode is required") SyncMode syncMode) {}
