package com.example.reportsync.entity;

/**
 * Sync state of a report against the external tracker.
 * NONE -> PENDING (enqueued) -> SYNCED | ERROR, ERROR -> PENDING on re-enqueue.
 */
public enum SyncStatus {
    NONE,
    PENDING,
    SYNCED,
    ERROR
}
