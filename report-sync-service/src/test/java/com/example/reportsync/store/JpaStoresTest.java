package com.example.reportsync.store;

import com.example.reportsync.config.JpaConfig;
import com.example.reportsync.entity.Integration;
import com.example.reportsync.entity.Report;
import com.example.reportsync.entity.ReportStatus;
import com.example.reportsync.entity.SyncStatus;
import com.example.reportsync.exception.ReportNotFoundException;
import com.example.reportsync.repository.IntegrationRepository;
import com.example.reportsync.repository.ReportRepository;
import com.example.reportsync.support.TestData;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JPA stores against H2: sync field update rules and the unsynced queries.
 */
@DataJpaTest
@ActiveProfiles("test")
@Import({JpaConfig.class, JpaReportStore.class, JpaIntegrationStore.class, JpaStoresTest.FixedClockConfig.class})
class JpaStoresTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private ReportRepository reportRepository;

    @Autowired
    private IntegrationRepository integrationRepository;

    @Autowired
    private JpaReportStore reportStore;

    @Autowired
    private JpaIntegrationStore integrationStore;

    @Test
    void testUpdateSyncStatus_SyncedStampsIssueAndTime() {
        // GIVEN
        reportRepository.saveAndFlush(TestData.report("rpt_1"));

        // WHEN
        reportStore.updateSyncStatus("rpt_1", SyncStatus.SYNCED, null, 123,
                "https://github.com/acme/shop/issues/123");

        // THEN
        Report report = reportRepository.findById("rpt_1").orElseThrow();
        assertThat(report.getSyncStatus()).isEqualTo(SyncStatus.SYNCED);
        assertThat(report.getIssueNumber()).isEqualTo(123);
        assertThat(report.getIssueUrl()).isEqualTo("https://github.com/acme/shop/issues/123");
        assertThat(report.getSyncedAt()).isEqualTo(NOW);
        assertThat(report.getCreatedAt()).isNotNull();
    }

    @Test
    void testUpdateSyncStatus_ErrorKeepsExistingIssue() {
        // GIVEN
        Report report = TestData.report("rpt_1");
        report.setSyncStatus(SyncStatus.SYNCED);
        report.setIssueNumber(7);
        report.setIssueUrl("https://github.com/acme/shop/issues/7");
        reportRepository.saveAndFlush(report);

        // WHEN
        reportStore.updateSyncStatus("rpt_1", SyncStatus.ERROR, "GitHub API error: Bad credentials", null, null);

        // THEN
        Report updated = reportRepository.findById("rpt_1").orElseThrow();
        assertThat(updated.getSyncStatus()).isEqualTo(SyncStatus.ERROR);
        assertThat(updated.getSyncError()).isEqualTo("GitHub API error: Bad credentials");
        assertThat(updated.getIssueNumber()).isEqualTo(7);
        assertThat(updated.getSyncedAt()).isNull();
    }

    @Test
    void testMarkPending_ClearsPreviousError() {
        Report report = TestData.report("rpt_1");
        report.setSyncStatus(SyncStatus.ERROR);
        report.setSyncError("timeout");
        reportRepository.saveAndFlush(report);

        reportStore.markPending("rpt_1");

        Report updated = reportRepository.findById("rpt_1").orElseThrow();
        assertThat(updated.getSyncStatus()).isEqualTo(SyncStatus.PENDING);
        assertThat(updated.getSyncError()).isNull();
    }

    @Test
    void testUpdateStatus_ResolvedStampsResolvedAt() {
        reportRepository.saveAndFlush(TestData.report("rpt_1"));

        reportStore.updateStatus("rpt_1", ReportStatus.RESOLVED);

        Report updated = reportRepository.findById("rpt_1").orElseThrow();
        assertThat(updated.getStatus()).isEqualTo(ReportStatus.RESOLVED);
        assertThat(updated.getResolvedAt()).isEqualTo(NOW);
    }

    @Test
    void testMissingReportThrows() {
        assertThatThrownBy(() -> reportStore.markPending("nope"))
                .isInstanceOf(ReportNotFoundException.class);
    }

    @Test
    void testFindByIssueNumber_ScopedToProject() {
        Report mine = TestData.report("rpt_1");
        mine.setIssueNumber(42);
        Report other = TestData.report("rpt_2");
        other.setProjectId("proj-2");
        other.setIssueNumber(42);
        reportRepository.saveAndFlush(mine);
        reportRepository.saveAndFlush(other);

        assertThat(reportStore.findByIssueNumber(TestData.PROJECT_ID, 42))
                .map(Report::getId).contains("rpt_1");
        assertThat(reportStore.findByIssueNumber("proj-3", 42)).isEmpty();
    }

    @Test
    void testUnsyncedMeansNeverSynced() {
        // GIVEN
        reportRepository.saveAndFlush(withSync(TestData.report("rpt_none"), SyncStatus.NONE));
        reportRepository.saveAndFlush(withSync(TestData.report("rpt_error"), SyncStatus.ERROR));
        reportRepository.saveAndFlush(withSync(TestData.report("rpt_pending"), SyncStatus.PENDING));
        reportRepository.saveAndFlush(withSync(TestData.report("rpt_synced"), SyncStatus.SYNCED));
        Report elsewhere = withSync(TestData.report("rpt_other"), SyncStatus.NONE);
        elsewhere.setProjectId("proj-2");
        reportRepository.saveAndFlush(elsewhere);

        // WHEN / THEN
        assertThat(reportStore.findUnsyncedIds(TestData.PROJECT_ID))
                .containsExactly("rpt_none");
        assertThat(reportStore.countUnsynced(TestData.PROJECT_ID)).isEqualTo(1);
        assertThat(reportStore.countUnsynced("proj-9")).isZero();
    }

    @Test
    void testUpdateLastUsed_IncrementsCounter() {
        integrationRepository.saveAndFlush(TestData.githubIntegration("int_1", TestData.githubConfig()));

        integrationStore.updateLastUsed("int_1");
        integrationStore.updateLastUsed("int_1");

        Integration integration = integrationRepository.findById("int_1").orElseThrow();
        assertThat(integration.getUsageCount()).isEqualTo(2);
        assertThat(integration.getLastUsedAt()).isEqualTo(NOW);
    }

    @Test
    void testUpdateLastUsed_UnknownIntegrationIsIgnored() {
        integrationStore.updateLastUsed("missing");

        assertThat(integrationRepository.count()).isZero();
    }

    @Test
    void testUpdateConfigAndFindByProject() {
        integrationStore.create(TestData.githubIntegration("int_1", TestData.githubConfig()));

        integrationStore.updateConfig("int_1", "{\"owner\":\"acme\",\"repo\":\"web\",\"accessToken\":\"t\"}");

        assertThat(integrationStore.findByProject(TestData.PROJECT_ID))
                .singleElement()
                .satisfies(i -> assertThat(i.getConfig()).contains("\"repo\":\"web\""));
    }

    private static Report withSync(Report report, SyncStatus status) {
        report.setSyncStatus(status);
        return report;
    }
}
