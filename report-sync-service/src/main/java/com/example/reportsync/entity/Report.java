package com.example.reportsync.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A user-filed bug report together with its sync state.
 *
 * Only the sync fields (and the status, on inbound webhook events) are written
 * by this service; everything else is owned by the report CRUD layer.
 */
@Entity
@Table(name = "reports", indexes = {
        @Index(name = "idx_reports_project_issue_number", columnList = "project_id,issue_number"),
        @Index(name = "idx_reports_project_sync_status", columnList = "project_id,sync_status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Report extends BaseEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "description", length = 20000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReportStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", length = 20)
    private ReportPriority priority;

    /**
     * Raw JSON captured by the widget (browser, device, console, network, activity trail).
     */
    @Column(name = "metadata", length = 100000)
    private String metadata;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", nullable = false, length = 20)
    private SyncStatus syncStatus = SyncStatus.NONE;

    @Column(name = "sync_error", length = 4000)
    private String syncError;

    @Column(name = "issue_number")
    private Integer issueNumber;

    @Column(name = "issue_url", length = 500)
    private String issueUrl;

    @Column(name = "synced_at")
    private Instant syncedAt;

    public boolean hasIssue() {
        return issueNumber != null;
    }

    /**
     * Move the report to a new status, stamping resolution/closing time.
     */
    public void changeStatus(ReportStatus newStatus, Instant now) {
        this.status = newStatus;
        switch (newStatus) {
            case RESOLVED -> this.resolvedAt = now;
            case CLOSED -> this.closedAt = now;
            case OPEN, IN_PROGRESS -> {
                this.resolvedAt = null;
                this.closedAt = null;
            }
        }
    }
}
