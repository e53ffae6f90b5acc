package com.example.reportsync.service;

import com.example.reportsync.client.external.GithubClient;
import com.example.reportsync.client.external.dto.GithubIssueDto;
import com.example.reportsync.dto.ActionResult;
import com.example.reportsync.dto.BatchSyncResultDto;
import com.example.reportsync.dto.IssueOverrides;
import com.example.reportsync.dto.IssueRef;
import com.example.reportsync.dto.SyncResultDto;
import com.example.reportsync.entity.Integration;
import com.example.reportsync.entity.IntegrationType;
import com.example.reportsync.entity.Report;
import com.example.reportsync.entity.ReportStatus;
import com.example.reportsync.entity.SyncStatus;
import com.example.reportsync.metrics.SyncMetrics;
import com.example.reportsync.model.GithubIntegrationConfig;
import com.example.reportsync.model.SyncErrorCode;
import com.example.reportsync.model.SyncMode;
import com.example.reportsync.store.IntegrationConfigMapper;
import com.example.reportsync.store.IntegrationStore;
import com.example.reportsync.store.ReportStore;
import com.example.reportsync.store.SettingsProvider;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrator for report ↔ GitHub issue sync.
 *
 * CRITICAL DESIGN:
 * - GitHub calls happen OUTSIDE transactions; the stores run short transactions afterwards
 * - Every operation returns a typed result, nothing escapes as an exception
 * - Report sync state machine: none/error → pending → synced | error
 * - Retry policy lives here and in the sync queue, never in the client
 */
@Service
@Slf4j
public class SyncOrchestrator {

    static final String WEBHOOK_PATH = "/api/webhooks/github/";
    private static final String SECRET_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SECRET_LENGTH = 32;

    private final IntegrationStore integrationStore;
    private final ReportStore reportStore;
    private final IntegrationConfigMapper configMapper;
    private final GithubClient githubClient;
    private final SettingsProvider settingsProvider;
    private final SyncMetrics syncMetrics;
    private final Sleeper sleeper;
    private final int maxAttempts;
    private final long[] retryDelaysMs;
    private final long batchDelayMs;
    private final SecureRandom random = new SecureRandom();

    public SyncOrchestrator(IntegrationStore integrationStore,
                            ReportStore reportStore,
                            IntegrationConfigMapper configMapper,
                            GithubClient githubClient,
                            SettingsProvider settingsProvider,
                            SyncMetrics syncMetrics,
                            Sleeper sleeper,
                            @Value("${report-sync.retry.max-attempts:3}") int maxAttempts,
                            @Value("${report-sync.retry.delays-ms:1000,5000,15000}") long[] retryDelaysMs,
                            @Value("${report-sync.batch.delay-ms:500}") long batchDelayMs) {
        this.integrationStore = integrationStore;
        this.reportStore = reportStore;
        this.configMapper = configMapper;
        this.githubClient = githubClient;
        this.settingsProvider = settingsProvider;
        this.syncMetrics = syncMetrics;
        this.sleeper = sleeper;
        this.maxAttempts = maxAttempts;
        this.retryDelaysMs = retryDelaysMs;
        this.batchDelayMs = batchDelayMs;
    }

    public SyncResultDto syncReport(String reportId, String integrationId) {
        return syncReport(reportId, integrationId, IssueOverrides.none());
    }

    /**
     * Push one report to its GitHub issue, creating the issue when the report has none yet.
     *
     * FLOW:
     * 1. Validate report and integration (NOT_FOUND, INVALID_TYPE, INACTIVE, CONFIG_ERROR)
     * 2. Create or update the issue (OUTSIDE transaction)
     * 3. Write synced/error back to the report (SHORT transaction)
     */
    public SyncResultDto syncReport(String reportId, String integrationId, IssueOverrides overrides) {
        long startTime = System.currentTimeMillis();

        Optional<Report> maybeReport = reportStore.findById(reportId);
        if (maybeReport.isEmpty()) {
            return SyncResultDto.failed(reportId, SyncErrorCode.NOT_FOUND, "Report not found");
        }
        Optional<Integration> maybeIntegration = integrationStore.findById(integrationId);
        if (maybeIntegration.isEmpty()) {
            return SyncResultDto.failed(reportId, SyncErrorCode.NOT_FOUND, "Integration not found");
        }
        Report report = maybeReport.get();
        Integration integration = maybeIntegration.get();
        if (integration.getType() != IntegrationType.GITHUB) {
            return SyncResultDto.failed(reportId, SyncErrorCode.INVALID_TYPE, "Integration is not a GitHub integration");
        }
        if (!integration.isActive()) {
            return SyncResultDto.failed(reportId, SyncErrorCode.INACTIVE, "Integration is not active");
        }

        GithubIntegrationConfig config;
        try {
            config = configMapper.readGithub(integration);
        } catch (IllegalStateException e) {
            log.error("Integration id={} has an unreadable config: {}", integrationId, e.getMessage());
            return SyncResultDto.failed(reportId, SyncErrorCode.CONFIG_ERROR, e.getMessage());
        }

        try {
            IssueRef issue;
            if (report.hasIssue()) {
                log.info("Updating GitHub issue #{} for reportId={}", report.getIssueNumber(), reportId);
                issue = githubClient.updateIssue(report.getIssueNumber(), report, config);
            } else {
                log.info("Creating GitHub issue for reportId={} in {}", reportId, config.fullName());
                issue = githubClient.createIssue(report, config, overrides);
            }

            reportStore.updateSyncStatus(reportId, SyncStatus.SYNCED, null, issue.issueNumber(), issue.issueUrl());
            integrationStore.updateLastUsed(integrationId);

            long duration = System.currentTimeMillis() - startTime;
            syncMetrics.recordSyncSuccess(duration);
            log.info("✅ Synced reportId={} to issue #{} in {}ms", reportId, issue.issueNumber(), duration);
            return SyncResultDto.synced(reportId, issue.issueNumber(), issue.issueUrl());

        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("❌ Failed to sync reportId={} with integrationId={}: {}", reportId, integrationId, message, e);
            writeError(reportId, message);
            syncMetrics.recordSyncFailure(System.currentTimeMillis() - startTime);
            return SyncResultDto.failed(reportId, SyncErrorCode.SYNC_FAILED, message);
        }
    }

    /**
     * syncReport with a bounded number of attempts.
     * Non-retryable failures (NOT_FOUND, INVALID_TYPE, INACTIVE, ...) return after the first attempt.
     */
    public SyncResultDto syncWithRetry(String reportId, String integrationId) {
        SyncResultDto result = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            result = syncReport(reportId, integrationId);
            if (result.isSuccess()) {
                if (attempt > 1) {
                    log.info("Sync of reportId={} succeeded on attempt {}/{}", reportId, attempt, maxAttempts);
                }
                return result;
            }
            if (!result.isRetryable()) {
                log.warn("Sync of reportId={} failed with {}, not retrying", reportId, result.getErrorCode());
                return result;
            }
            if (attempt < maxAttempts) {
                long delay = retryDelaysMs[Math.min(attempt - 1, retryDelaysMs.length - 1)];
                log.warn("Sync attempt {}/{} for reportId={} failed, retrying in {}ms: {}",
                        attempt, maxAttempts, reportId, delay, result.getErrorMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Retry of reportId={} interrupted after attempt {}", reportId, attempt);
                    return result;
                }
            }
        }

        String message = "Failed after " + maxAttempts + " attempts: " + result.getErrorMessage();
        log.error("❌ Giving up on reportId={}: {}", reportId, message);
        writeError(reportId, message);
        return SyncResultDto.failed(reportId, SyncErrorCode.SYNC_FAILED, message);
    }

    /**
     * Sync several reports one after the other, pausing between calls to stay under GitHub rate limits.
     * Individual failures are collected, they do not stop the batch.
     */
    public BatchSyncResultDto syncReports(List<String> reportIds, String integrationId) {
        boolean ownsCorrelationId = MDC.get("correlationId") == null;
        if (ownsCorrelationId) {
            MDC.put("correlationId", "SYNC-" + UUID.randomUUID().toString().substring(0, 8));
        }

        try {
            log.info("Starting batch sync of {} reports with integrationId={}", reportIds.size(), integrationId);
            for (String reportId : reportIds) {
                markPending(reportId);
            }

            List<SyncResultDto> results = new ArrayList<>();
            int successful = 0;
            for (int i = 0; i < reportIds.size(); i++) {
                SyncResultDto result = syncReport(reportIds.get(i), integrationId);
                results.add(result);
                if (result.isSuccess()) {
                    successful++;
                }
                if (i < reportIds.size() - 1 && batchDelayMs > 0) {
                    try {
                        sleeper.sleep(batchDelayMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.warn("Batch sync interrupted after {}/{} reports", i + 1, reportIds.size());
                        break;
                    }
                }
            }

            log.info("Batch sync finished: total={}, successful={}, failed={}",
                    results.size(), successful, results.size() - successful);
            return BatchSyncResultDto.builder()
                    .total(results.size())
                    .successful(successful)
                    .failed(results.size() - successful)
                    .results(results)
                    .build();
        } finally {
            if (ownsCorrelationId) {
                MDC.remove("correlationId");
            }
        }
    }

    /**
     * Switch the integration to automatic mode and register the inbound webhook.
     *
     * A failed webhook registration does not fail the operation: the integration
     * still syncs outbound, it just does not receive issue events.
     */
    public ActionResult enableAutoSync(String integrationId) {
        Optional<Integration> maybeIntegration = integrationStore.findById(integrationId);
        if (maybeIntegration.isEmpty()) {
            return ActionResult.fail(SyncErrorCode.NOT_FOUND, "Integration not found");
        }
        Integration integration = maybeIntegration.get();
        if (integration.getType() != IntegrationType.GITHUB) {
            return ActionResult.fail(SyncErrorCode.INVALID_TYPE, "Integration is not a GitHub integration");
        }
        Optional<String> baseUrl = settingsProvider.getPublicBaseUrl();
        if (baseUrl.isEmpty()) {
            return ActionResult.fail(SyncErrorCode.CONFIG_ERROR,
                    "Application URL is not configured. Set the public base URL before enabling automatic sync.");
        }

        try {
            GithubIntegrationConfig config = configMapper.readGithub(integration);
            GithubIntegrationConfig.GithubIntegrationConfigBuilder updated = config.toBuilder().syncMode(SyncMode.AUTOMATIC);

            if (config.getWebhookId() != null) {
                log.info("Integration id={} already has webhook id={}, keeping it", integrationId, config.getWebhookId());
            } else {
                String secret = generateWebhookSecret();
                String callbackUrl = baseUrl.get() + WEBHOOK_PATH + integrationId;
                try {
                    String webhookId = githubClient.createWebhook(config, callbackUrl, secret);
                    updated.webhookId(webhookId).webhookSecret(secret);
                    log.info("Registered webhook id={} for integrationId={}", webhookId, integrationId);
                } catch (RuntimeException e) {
                    log.warn("⚠️ Webhook registration failed for integrationId={}, continuing with outbound-only sync: {}",
                            integrationId, e.getMessage());
                }
            }

            integrationStore.updateConfig(integrationId, configMapper.write(updated.build()));
            log.info("Automatic sync enabled for integrationId={}", integrationId);
            return ActionResult.ok();
        } catch (Exception e) {
            log.error("Failed to enable automatic sync for integrationId={}: {}", integrationId, e.getMessage(), e);
            return ActionResult.fail(SyncErrorCode.SYNC_FAILED, e.getMessage());
        }
    }

    /**
     * Switch back to manual mode. The remote webhook is removed best-effort;
     * the local webhook id and secret are always cleared.
     */
    public ActionResult disableAutoSync(String integrationId) {
        Optional<Integration> maybeIntegration = integrationStore.findById(integrationId);
        if (maybeIntegration.isEmpty()) {
            return ActionResult.fail(SyncErrorCode.NOT_FOUND, "Integration not found");
        }
        Integration integration = maybeIntegration.get();
        if (integration.getType() != IntegrationType.GITHUB) {
            return ActionResult.fail(SyncErrorCode.INVALID_TYPE, "Integration is not a GitHub integration");
        }

        try {
            GithubIntegrationConfig config = configMapper.readGithub(integration);
            if (config.getWebhookId() != null) {
                try {
                    githubClient.deleteWebhook(config, config.getWebhookId());
                } catch (RuntimeException e) {
                    log.warn("⚠️ Could not delete webhook id={} for integrationId={}: {}",
                            config.getWebhookId(), integrationId, e.getMessage());
                }
            }

            GithubIntegrationConfig updated = config.toBuilder()
                    .syncMode(SyncMode.MANUAL)
                    .webhookId(null)
                    .webhookSecret(null)
                    .build();
            integrationStore.updateConfig(integrationId, configMapper.write(updated));
            log.info("Automatic sync disabled for integrationId={}", integrationId);
            return ActionResult.ok();
        } catch (Exception e) {
            log.error("Failed to disable automatic sync for integrationId={}: {}", integrationId, e.getMessage(), e);
            return ActionResult.fail(SyncErrorCode.SYNC_FAILED, e.getMessage());
        }
    }

    /**
     * Apply an inbound issue event to the matching report.
     *
     * Only two transitions exist: closed issue → resolved report, reopened issue → open report.
     * Issues without a tracked report and every other action are no-ops.
     */
    public ActionResult handleWebhook(String integrationId, String action, GithubIssueDto issue) {
        Optional<Integration> maybeIntegration = integrationStore.findById(integrationId);
        if (maybeIntegration.isEmpty()) {
            return ActionResult.fail(SyncErrorCode.NOT_FOUND, "Integration not found");
        }

        try {
            Optional<Report> maybeReport = reportStore.findByIssueNumber(maybeIntegration.get().getProjectId(), issue.number());
            if (maybeReport.isEmpty()) {
                log.debug("No report tracks issue #{} of integrationId={}", issue.number(), integrationId);
                return ActionResult.ok();
            }
            Report report = maybeReport.get();
            ReportStatus current = report.getStatus();

            if ("closed".equals(action) && "closed".equals(issue.state())) {
                if (current != ReportStatus.RESOLVED && current != ReportStatus.CLOSED) {
                    reportStore.updateStatus(report.getId(), ReportStatus.RESOLVED);
                    log.info("Issue #{} closed, reportId={} {} → RESOLVED", issue.number(), report.getId(), current);
                }
            } else if ("reopened".equals(action) && "open".equals(issue.state())) {
                if (current == ReportStatus.RESOLVED || current == ReportStatus.CLOSED) {
                    reportStore.updateStatus(report.getId(), ReportStatus.OPEN);
                    log.info("Issue #{} reopened, reportId={} {} → OPEN", issue.number(), report.getId(), current);
                }
            }
            return ActionResult.ok();
        } catch (Exception e) {
            log.error("Failed to apply issue event action={} issue=#{} for integrationId={}: {}",
                    action, issue.number(), integrationId, e.getMessage(), e);
            return ActionResult.fail(SyncErrorCode.SYNC_FAILED, e.getMessage());
        }
    }

    /**
     * The project's active GitHub integration in automatic mode, if any.
     */
    public Optional<Integration> getAutoSyncIntegration(String projectId) {
        return integrationStore.findByProject(projectId).stream()
                .filter(i -> i.getType() == IntegrationType.GITHUB && i.isActive())
                .filter(this::isAutomatic)
                .findFirst();
    }

    public long getUnsyncedCount(String projectId) {
        return reportStore.countUnsynced(projectId);
    }

    public List<String> getUnsyncedReportIds(String projectId) {
        return reportStore.findUnsyncedIds(projectId);
    }

    private boolean isAutomatic(Integration integration) {
        try {
            return configMapper.readGithub(integration).effectiveSyncMode() == SyncMode.AUTOMATIC;
        } catch (RuntimeException e) {
            log.warn("Skipping integration id={} with unreadable config: {}", integration.getId(), e.getMessage());
            return false;
        }
    }

    private void markPending(String reportId) {
        try {
            reportStore.markPending(reportId);
        } catch (RuntimeException e) {
            log.warn("Could not mark reportId={} pending: {}", reportId, e.getMessage());
        }
    }

    private void writeError(String reportId, String message) {
        try {
            reportStore.updateSyncStatus(reportId, SyncStatus.ERROR, message, null, null);
        } catch (RuntimeException e) {
            log.error("Could not record sync error on reportId={}: {}", reportId, e.getMessage(), e);
        }
    }

    String generateWebhookSecret() {
        StringBuilder secret = new StringBuilder(SECRET_LENGTH);
        for (int i = 0; i < SECRET_LENGTH; i++) {
            secret.append(SECRET_ALPHABET.charAt(random.nextInt(SECRET_ALPHABET.length())));
        }
        return secret.toString();
    }
}
