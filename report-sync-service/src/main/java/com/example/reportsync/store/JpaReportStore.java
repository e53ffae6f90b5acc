package com.example.reportsync.store;

import com.example.reportsync.entity.Report;
import com.example.reportsync.entity.ReportStatus;
import com.example.reportsync.entity.SyncStatus;
import com.example.reportsync.exception.ReportNotFoundException;
import com.example.reportsync.repository.ReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JPA backed report store. Only touches the sync fields and the status.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaReportStore implements ReportStore {

    /**
     * Never synced. Failed reports are re-queued through the per-report retry, not by bulk sync.
     */
    private static final Set<SyncStatus> UNSYNCED = EnumSet.of(SyncStatus.NONE);

    private final ReportRepository reportRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<Report> findById(String reportId) {
        return reportRepository.findById(reportId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Report> findByIssueNumber(String projectId, int issueNumber) {
        return reportRepository.findFirstByProjectIdAndIssueNumber(projectId, issueNumber);
    }

    @Override
    @Transactional
    public void updateSyncStatus(String reportId, SyncStatus status, String error,
                                 Integer issueNumber, String issueUrl) {
        Report report = load(reportId);
        report.setSyncStatus(status);
        report.setSyncError(error);
        if (issueNumber != null) {
            report.setIssueNumber(issueNumber);
        }
        if (issueUrl != null) {
            report.setIssueUrl(issueUrl);
        }
        if (status == SyncStatus.SYNCED) {
            report.setSyncedAt(clock.instant());
        }
        reportRepository.save(report);
        log.debug("Report id={} syncStatus={} issueNumber={}", reportId, status, report.getIssueNumber());
    }

    @Override
    @Transactional
    public void markPending(String reportId) {
        Report report = load(reportId);
        report.setSyncStatus(SyncStatus.PENDING);
        report.setSyncError(null);
        reportRepository.save(report);
    }

    @Override
    @Transactional
    public void updateStatus(String reportId, ReportStatus status) {
        Report report = load(reportId);
        report.changeStatus(status, clock.instant());
        reportRepository.save(report);
        log.info("Report id={} status changed to {}", reportId, status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findUnsyncedIds(String projectId) {
        return reportRepository.findIdsByProjectIdAndSyncStatusIn(projectId, UNSYNCED);
    }

    @Override
    @Transactional(readOnly = true)
    public long countUnsynced(String projectId) {
        return reportRepository.countByProjectIdAndSyncStatusIn(projectId, UNSYNCED);
    }

    private Report load(String reportId) {
        return reportRepository.findById(reportId)
                .orElseThrow(() -> new ReportNotFoundException(reportId));
    }
}
