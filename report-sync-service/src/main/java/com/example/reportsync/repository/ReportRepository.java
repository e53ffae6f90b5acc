package com.example.reportsync.repository;

import com.example.reportsync.entity.Report;
import com.example.reportsync.entity.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Report entity.
 * Only the lookups needed by the sync engine; report CRUD lives elsewhere.
 */
@Repository
public interface ReportRepository extends JpaRepository<Report, String> {

    /**
     * Webhook dispatch: map a remote issue back onto the local report.
     */
    Optional<Report> findFirstByProjectIdAndIssueNumber(String projectId, Integer issueNumber);

    @Query("SELECT r.id FROM Report r WHERE r.projectId = :projectId " +
            "AND r.syncStatus IN :statuses ORDER BY r.createdAt ASC")
    List<String> findIdsByProjectIdAndSyncStatusIn(@Param("projectId") String projectId,
                                                   @Param("statuses") Collection<SyncStatus> statuses);

    long countByProjectIdAndSyncStatusIn(String projectId, Collection<SyncStatus> statuses);
}
