package com.example.reportsync.controller;

import com.example.reportsync.dto.BatchSyncResultDto;
import com.example.reportsync.dto.QueuedResponse;
import com.example.reportsync.dto.SyncModeResponse;
import com.example.reportsync.dto.SyncResultDto;
import com.example.reportsync.dto.SyncStatusResponse;
import com.example.reportsync.exception.BadRequestException;
import com.example.reportsync.exception.IntegrationNotFoundException;
import com.example.reportsync.exception.SyncFailedException;
import com.example.reportsync.model.SyncMode;
import com.example.reportsync.service.IntegrationSyncService;
import com.example.reportsync.service.SyncOrchestrator;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({IntegrationSyncController.class, ReportSyncController.class})
class IntegrationSyncControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IntegrationSyncService integrationSyncService;

    @MockBean
    private SyncOrchestrator syncOrchestrator;

    @Test
    void testSetSyncMode() throws Exception {
        when(integrationSyncService.setSyncMode("int_1", SyncMode.AUTOMATIC))
                .thenReturn(SyncModeResponse.builder().syncMode(SyncMode.AUTOMATIC).changed(true).unsyncedCount(4).build());

        mockMvc.perform(post("/api/integrations/int_1/sync-mode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"syncMode\":\"automatic\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.syncMode").value("automatic"))
                .andExpect(jsonPath("$.data.changed").value(true))
                .andExpect(jsonPath("$.data.unsyncedCount").value(4))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void testSetSyncMode_ValidationAndUnknownMode() throws Exception {
        mockMvc.perform(post("/api/integrations/int_1/sync-mode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/integrations/int_1/sync-mode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"syncMode\":\"sometimes\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST_BODY"));

        verifyNoInteractions(integrationSyncService);
    }

    @Test
    void testSetSyncMode_ErrorMapping() throws Exception {
        when(integrationSyncService.setSyncMode(eq("missing"), any()))
                .thenThrow(new IntegrationNotFoundException("missing"));
        when(integrationSyncService.setSyncMode(eq("int_jira"), any()))
                .thenThrow(new BadRequestException("INVALID_TYPE", "Only GitHub integrations support sync modes"));
        when(integrationSyncService.setSyncMode(eq("int_broken"), any()))
                .thenThrow(new SyncFailedException("db down"));

        mockMvc.perform(post("/api/integrations/missing/sync-mode")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"syncMode\":\"manual\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("INTEGRATION_NOT_FOUND"));
        mockMvc.perform(post("/api/integrations/int_jira/sync-mode")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"syncMode\":\"manual\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_TYPE"))
                .andExpect(jsonPath("$.error.message").value("Only GitHub integrations support sync modes"));
        mockMvc.perform(post("/api/integrations/int_broken/sync-mode")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"syncMode\":\"manual\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("SYNC_FAILED"));
    }

    @Test
    void testSyncExisting_AcceptsAllOrArray() throws Exception {
        when(integrationSyncService.syncExisting(eq("int_1"), any()))
                .thenReturn(new QueuedResponse(2, "Queued 2 reports for sync"));

        mockMvc.perform(post("/api/integrations/int_1/sync-existing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reportIds\":\"all\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.queued").value(2))
                .andExpect(jsonPath("$.data.message").value("Queued 2 reports for sync"));

        mockMvc.perform(post("/api/integrations/int_1/sync-existing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reportIds\":[\"rpt_1\",\"rpt_2\"]}"))
                .andExpect(status().isOk());

        verify(integrationSyncService).syncExisting(eq("int_1"), argThat((JsonNode n) -> n != null && n.isTextual()));
        verify(integrationSyncService).syncExisting(eq("int_1"), argThat((JsonNode n) -> n != null && n.isArray() && n.size() == 2));
    }

    @Test
    void testGetSyncStatus() throws Exception {
        when(integrationSyncService.getSyncStatus("int_1")).thenReturn(SyncStatusResponse.builder()
                .syncMode(SyncMode.MANUAL).unsyncedCount(3).queueLength(1).processing(false).build());

        mockMvc.perform(get("/api/integrations/int_1/sync-status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.syncMode").value("manual"))
                .andExpect(jsonPath("$.data.unsyncedCount").value(3))
                .andExpect(jsonPath("$.data.queueLength").value(1))
                .andExpect(jsonPath("$.data.processing").value(false));
    }

    @Test
    void testBatchSync() throws Exception {
        when(syncOrchestrator.syncReports(List.of("rpt_1", "rpt_2"), "int_1")).thenReturn(BatchSyncResultDto.builder()
                .total(2).successful(1).failed(1)
                .results(List.of(SyncResultDto.synced("rpt_1", 5, "u")))
                .build());

        mockMvc.perform(post("/api/integrations/int_1/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reportIds\":[\"rpt_1\",\"rpt_2\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(2))
                .andExpect(jsonPath("$.data.successful").value(1))
                .andExpect(jsonPath("$.data.results[0].issueNumber").value(5));

        mockMvc.perform(post("/api/integrations/int_1/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reportIds\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testSingleSyncWithRetry() throws Exception {
        when(syncOrchestrator.syncWithRetry("rpt_1", "int_1"))
                .thenReturn(SyncResultDto.synced("rpt_1", 123, "https://github.com/acme/shop/issues/123"));

        mockMvc.perform(post("/api/integrations/int_1/reports/rpt_1/sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(jsonPath("$.data.issueNumber").value(123));
    }

    @Test
    void testRetrySyncForReport() throws Exception {
        when(integrationSyncService.retrySyncForReport("rpt_1"))
                .thenReturn(new QueuedResponse(1, "Report queued for sync"));
        when(integrationSyncService.retrySyncForReport("rpt_orphan"))
                .thenThrow(new BadRequestException("INTEGRATION_NOT_FOUND", "No active GitHub integration found"));

        mockMvc.perform(post("/api/reports/rpt_1/sync/retry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.queued").value(1));
        mockMvc.perform(post("/api/reports/rpt_orphan/sync/retry"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INTEGRATION_NOT_FOUND"));
    }
}
