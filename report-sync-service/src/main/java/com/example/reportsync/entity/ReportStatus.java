package com.example.reportsync.entity;

public enum ReportStatus {
    OPEN,
    IN_PROGRESS,
    RESOLVED,
    CLOSED;

    /**
     * Resolved and closed reports map to a closed issue on the tracker.
     */
    public boolean isFinished() {
        return this == RESOLVED || this == CLOSED;
    }
}
