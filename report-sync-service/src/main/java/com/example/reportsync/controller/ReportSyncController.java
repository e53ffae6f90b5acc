package com.example.reportsync.controller;

import com.example.reportsync.dto.QueuedResponse;
import com.example.reportsync.service.IntegrationSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Slf4j
public class ReportSyncController {

    private final IntegrationSyncService integrationSyncService;

    /**
     * POST /api/reports/{reportId}/sync/retry
     * Put a report back into the sync queue, e.g. after a sync error.
     */
    @PostMapping("/{reportId}/sync/retry")
    public ResponseEntity<Map<String, Object>> retrySync(@PathVariable String reportId) {
        log.info("Retrying sync of reportId={}", reportId);
        QueuedResponse response = integrationSyncService.retrySyncForReport(reportId);
        return ResponseEntity.ok(Map.of(
                "data", response,
                "timestamp", Instant.now().toString()
        ));
    }
}
