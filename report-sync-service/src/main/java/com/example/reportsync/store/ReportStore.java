package com.example.reportsync.store;

import com.example.reportsync.entity.Report;
import com.example.reportsync.entity.ReportStatus;
import com.example.reportsync.entity.SyncStatus;

import java.util.List;
import java.util.Optional;

/**
 * Report persistence as seen by the sync engine.
 */
public interface ReportStore {

    Optional<Report> findById(String reportId);

    Optional<Report> findByIssueNumber(String projectId, int issueNumber);

    /**
     * Write the sync fields of a report.
     * A null issue number/url keeps the stored one; syncedAt is only stamped for {@link SyncStatus#SYNCED}.
     */
    void updateSyncStatus(String reportId, SyncStatus status, String error, Integer issueNumber, String issueUrl);

    void markPending(String reportId);

    void updateStatus(String reportId, ReportStatus status);

    /**
     * Reports of the project that were never pushed or whose last push failed.
     */
    List<String> findUnsyncedIds(String projectId);

    long countUnsynced(String projectId);
}
