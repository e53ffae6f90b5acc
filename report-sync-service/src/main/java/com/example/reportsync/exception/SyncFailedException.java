package com.example.reportsync.exception;

/**
 * An orchestrator action failed for a reason the admin cannot fix by changing the request.
 * Maps to 500 SYNC_FAILED
 */
public class SyncFailedException extends RuntimeException {

    public SyncFailedException(String message) {
        super(message);
    }
}
