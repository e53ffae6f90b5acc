package com.example.reportsync.service;

/**
 * Published by the report CRUD layer after a report was created or updated.
 */
public record ReportChangedEvent(String reportId, String projectId, Change change) {

    public enum Change {
        CREATED,
        UPDATED
    }
}
