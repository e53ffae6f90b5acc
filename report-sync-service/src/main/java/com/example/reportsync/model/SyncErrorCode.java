package com.example.reportsync.model;

/**
 * Failure classification shared by the orchestrator, the queue and the admin API.
 */
public enum SyncErrorCode {
    NOT_FOUND(false),
    INVALID_TYPE(false),
    INACTIVE(false),
    SETTINGS_ERROR(false),
    CONFIG_ERROR(false),
    INTEGRATION_NOT_FOUND(false),
    SYNC_FAILED(true);

    private final boolean retryable;

    SyncErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
