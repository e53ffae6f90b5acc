package com.example.reportsync.controller;

import com.example.reportsync.dto.BatchSyncResultDto;
import com.example.reportsync.dto.QueuedResponse;
import com.example.reportsync.dto.SyncModeResponse;
import com.example.reportsync.dto.SyncResultDto;
import com.example.reportsync.dto.SyncStatusResponse;
import com.example.reportsync.dto.request.SetSyncModeRequest;
import com.example.reportsync.dto.request.SyncExistingRequest;
import com.example.reportsync.dto.request.SyncReportsRequest;
import com.example.reportsync.service.IntegrationSyncService;
import com.example.reportsync.service.SyncOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

/**
 * Sync endpoints of a single integration, used by the admin UI.
 *
 * Base path: /api/integrations/{integrationId}
 */
@RestController
@RequestMapping("/api/integrations/{integrationId}")
@RequiredArgsConstructor
@Slf4j
public class IntegrationSyncController {

    private final IntegrationSyncService integrationSyncService;
    private final SyncOrchestrator syncOrchestrator;

    /**
     * POST /api/integrations/{id}/sync-mode
     * Switch between manual and automatic sync. Registers or removes the GitHub webhook.
     */
    @PostMapping("/sync-mode")
    public ResponseEntity<Map<String, Object>> setSyncMode(
            @PathVariable String integrationId,
            @Valid @RequestBody SetSyncModeRequest request) {
        log.info("Setting sync mode of integrationId={} to {}", integrationId, request.syncMode());
        SyncModeResponse response = integrationSyncService.setSyncMode(integrationId, request.syncMode());
        return ok(response);
    }

    /**
     * POST /api/integrations/{id}/sync-existing
     * Queue existing reports. reportIds is a list of ids or "all".
     */
    @PostMapping("/sync-existing")
    public ResponseEntity<Map<String, Object>> syncExisting(
            @PathVariable String integrationId,
            @RequestBody SyncExistingRequest request) {
        QueuedResponse response = integrationSyncService.syncExisting(integrationId, request.reportIds());
        log.info("Sync-existing for integrationId={}: {}", integrationId, response.message());
        return ok(response);
    }

    @GetMapping("/sync-status")
    public ResponseEntity<Map<String, Object>> getSyncStatus(@PathVariable String integrationId) {
        SyncStatusResponse response = integrationSyncService.getSyncStatus(integrationId);
        return ok(response);
    }

    /**
     * POST /api/integrations/{id}/sync
     * Synchronous batch sync. Blocks for roughly batch delay times report count.
     */
    @PostMapping("/sync")
    public ResponseEntity<Map<String, Object>> syncReports(
            @PathVariable String integrationId,
            @Valid @RequestBody SyncReportsRequest request) {
        log.info("Batch sync of {} reports to integrationId={}", request.reportIds().size(), integrationId);
        BatchSyncResultDto result = syncOrchestrator.syncReports(request.reportIds(), integrationId);
        return ok(result);
    }

    @PostMapping("/reports/{reportId}/sync")
    public ResponseEntity<Map<String, Object>> syncReport(
            @PathVariable String integrationId,
            @PathVariable String reportId) {
        SyncResultDto result = syncOrchestrator.syncWithRetry(reportId, integrationId);
        return ok(result);
    }

    private static ResponseEntity<Map<String, Object>> ok(Object data) {
        return ResponseEntity.ok(Map.of(
                "data", data,
                "timestamp", Instant.now().toString()
        ));
    }
}
