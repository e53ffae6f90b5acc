package com.example.reportsync.service;

import com.example.reportsync.dto.ActionResult;
import com.example.reportsync.dto.QueuedResponse;
import com.example.reportsync.dto.SyncModeResponse;
import com.example.reportsync.dto.SyncQueueStatusDto;
import com.example.reportsync.dto.SyncStatusResponse;
import com.example.reportsync.entity.Integration;
import com.example.reportsync.entity.IntegrationType;
import com.example.reportsync.entity.Report;
import com.example.reportsync.exception.BadRequestException;
import com.example.reportsync.exception.IntegrationNotFoundException;
import com.example.reportsync.exception.ReportNotFoundException;
import com.example.reportsync.exception.SyncFailedException;
import com.example.reportsync.model.GithubIntegrationConfig;
import com.example.reportsync.model.SyncErrorCode;
import com.example.reportsync.model.SyncMode;
import com.example.reportsync.queue.SyncQueue;
import com.example.reportsync.store.IntegrationConfigMapper;
import com.example.reportsync.store.IntegrationStore;
import com.example.reportsync.store.ReportStore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sync-mode operations behind the admin UI.
 * Translates orchestrator results into exceptions the REST layer maps to status codes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntegrationSyncService {

    private final SyncOrchestrator syncOrchestrator;
    private final SyncQueue syncQueue;
    private final IntegrationStore integrationStore;
    private final ReportStore reportStore;
    private final IntegrationConfigMapper configMapper;

    public SyncModeResponse setSyncMode(String integrationId, SyncMode syncMode) {
        Integration integration = loadGithubIntegration(integrationId, "Only GitHub integrations support sync modes");
        SyncMode current = readConfig(integration).effectiveSyncMode();

        if (current == syncMode) {
            return SyncModeResponse.builder()
                    .syncMode(syncMode)
                    .changed(false)
                    .message("Sync mode is already " + syncMode.getValue())
                    .build();
        }

        ActionResult result = syncMode == SyncMode.AUTOMATIC
                ? syncOrchestrator.enableAutoSync(integrationId)
                : syncOrchestrator.disableAutoSync(integrationId);
        if (!result.success()) {
            throw toException(integrationId, result);
        }

        Integer unsyncedCount = syncMode == SyncMode.AUTOMATIC
                ? (int) syncOrchestrator.getUnsyncedCount(integration.getProjectId())
                : null;
        log.info("Sync mode of integrationId={} changed {} -> {}", integrationId, current, syncMode);
        return SyncModeResponse.builder()
                .syncMode(syncMode)
                .changed(true)
                .unsyncedCount(unsyncedCount)
                .build();
    }

    /**
     * Queue existing reports of the integration's project.
     *
     * @param reportIds JSON array of report ids, or the string "all" for every unsynced report
     */
    public QueuedResponse syncExisting(String integrationId, JsonNode reportIds) {
        Integration integration = loadGithubIntegration(integrationId, "Only GitHub integrations support syncing");

        List<String> ids;
        if (reportIds != null && reportIds.isTextual() && "all".equals(reportIds.asText())) {
            ids = syncOrchestrator.getUnsyncedReportIds(integration.getProjectId());
        } else if (reportIds != null && reportIds.isArray()) {
            ids = new ArrayList<>();
            for (JsonNode id : reportIds) {
                ids.add(id.asText());
            }
        } else {
            throw new BadRequestException("INVALID_PARAMS", "reportIds must be an array or \"all\"");
        }

        if (ids.isEmpty()) {
            return new QueuedResponse(0, "No reports to sync");
        }

        int queued = 0;
        for (String reportId : ids) {
            if (!belongsToProject(reportId, integration.getProjectId())) {
                log.warn("Skipping reportId={}: not a report of projectId={}", reportId, integration.getProjectId());
                continue;
            }
            if (syncQueue.enqueue(reportId, integrationId)) {
                queued++;
            }
        }
        return new QueuedResponse(queued, "Queued " + queued + " reports for sync");
    }

    public SyncStatusResponse getSyncStatus(String integrationId) {
        Integration integration = loadGithubIntegration(integrationId, "Only GitHub integrations support sync status");
        SyncQueueStatusDto queueStatus = syncQueue.getStatus();
        return SyncStatusResponse.builder()
                .syncMode(readConfig(integration).effectiveSyncMode())
                .unsyncedCount((int) syncOrchestrator.getUnsyncedCount(integration.getProjectId()))
                .queueLength(queueStatus.queueLength())
                .processing(queueStatus.processing())
                .build();
    }

    /**
     * Queue one report again, against the first active GitHub integration of its project.
     */
    public QueuedResponse retrySyncForReport(String reportId) {
        Report report = reportStore.findById(reportId)
                .orElseThrow(() -> new ReportNotFoundException(reportId));

        Optional<Integration> integration = integrationStore.findByProject(report.getProjectId()).stream()
                .filter(i -> i.getType() == IntegrationType.GITHUB && i.isActive())
                .findFirst();
        if (integration.isEmpty()) {
            throw new BadRequestException(SyncErrorCode.INTEGRATION_NOT_FOUND.name(), "No active GitHub integration found");
        }

        boolean queued = syncQueue.enqueue(reportId, integration.get().getId());
        return new QueuedResponse(queued ? 1 : 0, queued ? "Report queued for sync" : "Report is already queued");
    }

    Integration loadGithubIntegration(String integrationId, String wrongTypeMessage) {
        Integration integration = integrationStore.findById(integrationId)
                .orElseThrow(() -> new IntegrationNotFoundException(integrationId));
        if (integration.getType() != IntegrationType.GITHUB) {
            throw new BadRequestException(SyncErrorCode.INVALID_TYPE.name(), wrongTypeMessage);
        }
        return integration;
    }

    private GithubIntegrationConfig readConfig(Integration integration) {
        try {
            return configMapper.readGithub(integration);
        } catch (IllegalStateException e) {
            throw new BadRequestException(SyncErrorCode.CONFIG_ERROR.name(), e.getMessage());
        }
    }

    private boolean belongsToProject(String reportId, String projectId) {
        return reportStore.findById(reportId)
                .map(r -> projectId.equals(r.getProjectId()))
                .orElse(false);
    }

    private RuntimeException toException(String integrationId, ActionResult result) {
        SyncErrorCode code = result.errorCode();
        if (code == SyncErrorCode.NOT_FOUND) {
            return new IntegrationNotFoundException(integrationId);
        }
        if (code == null || code == SyncErrorCode.SYNC_FAILED) {
            return new SyncFailedException(result.errorMessage());
        }
        return new BadRequestException(code.name(), result.errorMessage());
    }
}
