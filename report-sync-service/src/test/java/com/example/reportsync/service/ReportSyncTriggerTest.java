package com.example.reportsync.service;

import com.example.reportsync.entity.Integration;
import com.example.reportsync.queue.SyncQueue;
import com.example.reportsync.support.TestData;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReportSyncTriggerTest {

    private final SyncOrchestrator orchestrator = mock(SyncOrchestrator.class);
    private final SyncQueue syncQueue = mock(SyncQueue.class);
    private final ReportSyncTrigger trigger = new ReportSyncTrigger(orchestrator, syncQueue);

    private static ReportChangedEvent created(String reportId) {
        return new ReportChangedEvent(reportId, TestData.PROJECT_ID, ReportChangedEvent.Change.CREATED);
    }

    @Test
    void testQueuesReportWhenProjectHasAutoSync() {
        Integration integration = TestData.githubIntegration("int_1", TestData.githubConfig());
        when(orchestrator.getAutoSyncIntegration(TestData.PROJECT_ID)).thenReturn(Optional.of(integration));

        trigger.onReportChanged(created("rpt_1"));

        verify(syncQueue).enqueue("rpt_1", "int_1");
    }

    @Test
    void testDoesNothingInManualMode() {
        when(orchestrator.getAutoSyncIntegration(TestData.PROJECT_ID)).thenReturn(Optional.empty());

        trigger.onReportChanged(created("rpt_1"));

        verify(syncQueue, never()).enqueue(anyString(), anyString());
    }

    @Test
    void testFailuresNeverReachThePublisher() {
        when(orchestrator.getAutoSyncIntegration(TestData.PROJECT_ID))
                .thenThrow(new IllegalStateException("db down"));

        assertThatNoException().isThrownBy(() -> trigger.onReportChanged(created("rpt_1")));
    }
}
