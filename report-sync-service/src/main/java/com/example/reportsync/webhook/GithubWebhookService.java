package com.example.reportsync.webhook;

import com.example.reportsync.dto.ActionResult;
import com.example.reportsync.entity.Integration;
import com.example.reportsync.entity.IntegrationType;
import com.example.reportsync.metrics.SyncMetrics;
import com.example.reportsync.model.GithubIntegrationConfig;
import com.example.reportsync.service.SyncOrchestrator;
import com.example.reportsync.store.IntegrationConfigMapper;
import com.example.reportsync.store.IntegrationStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * Inbound GitHub webhook pipeline.
 *
 * Order matters: integration lookup (404), type check (400), signature (401),
 * JSON parse (400), then dispatch by event. Failures are terminal for the delivery;
 * GitHub's own redelivery is the retry path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GithubWebhookService {

    private static final Set<String> SUPPORTED_ACTIONS = Set.of("opened", "closed", "reopened");

    private final IntegrationStore integrationStore;
    private final IntegrationConfigMapper configMapper;
    private final WebhookSignatureVerifier signatureVerifier;
    private final SyncOrchestrator syncOrchestrator;
    private final ObjectMapper objectMapper;
    private final SyncMetrics syncMetrics;

    public WebhookResponse handle(String integrationId, String event, String deliveryId,
                                  String signature, byte[] rawBody) {
        log.debug("Received GitHub webhook integrationId={} event={} delivery={} hasSignature={}",
                integrationId, event, deliveryId, signature != null && !signature.isEmpty());

        Optional<Integration> maybeIntegration = integrationStore.findById(integrationId);
        if (maybeIntegration.isEmpty()) {
            log.warn("GitHub webhook for unknown integrationId={}", integrationId);
            syncMetrics.recordWebhook("not_found");
            return WebhookResponse.error(HttpStatus.NOT_FOUND, "Integration not found");
        }
        Integration integration = maybeIntegration.get();
        if (integration.getType() != IntegrationType.GITHUB) {
            log.warn("GitHub webhook for non-GitHub integrationId={}", integrationId);
            syncMetrics.recordWebhook("invalid");
            return WebhookResponse.error(HttpStatus.BAD_REQUEST, "Invalid integration type");
        }

        GithubIntegrationConfig config;
        try {
            config = configMapper.readGithub(integration);
        } catch (IllegalStateException e) {
            log.error("GitHub webhook for integrationId={} with unreadable config: {}", integrationId, e.getMessage());
            syncMetrics.recordWebhook("failed");
            return WebhookResponse.error(HttpStatus.INTERNAL_SERVER_ERROR, "Integration config unreadable");
        }

        WebhookSignatureVerifier.Verification verification =
                signatureVerifier.verify(rawBody, signature, config.getWebhookSecret());
        switch (verification) {
            case MISSING_SIGNATURE -> {
                log.warn("GitHub webhook missing signature for integrationId={}", integrationId);
                syncMetrics.recordWebhook("unauthorized");
                return WebhookResponse.error(HttpStatus.UNAUTHORIZED, "Missing signature");
            }
            case INVALID_SIGNATURE -> {
                log.warn("GitHub webhook signature mismatch for integrationId={}", integrationId);
                syncMetrics.recordWebhook("unauthorized");
                return WebhookResponse.error(HttpStatus.UNAUTHORIZED, "Invalid signature");
            }
            case DISABLED -> log.debug("No webhook secret on integrationId={}, signature not checked", integrationId);
            case ACCEPTED -> log.debug("Signature verified for integrationId={}", integrationId);
        }

        GithubWebhookPayload payload;
        try {
            payload = objectMapper.readValue(rawBody, GithubWebhookPayload.class);
        } catch (IOException e) {
            log.warn("GitHub webhook with invalid JSON for integrationId={}: {}", integrationId, e.getMessage());
            syncMetrics.recordWebhook("invalid");
            return WebhookResponse.error(HttpStatus.BAD_REQUEST, "Invalid JSON");
        }

        if ("ping".equals(event)) {
            log.info("GitHub webhook ping received for integrationId={}", integrationId);
            syncMetrics.recordWebhook("ping");
            return WebhookResponse.message("pong");
        }

        if (!"issues".equals(event) || payload == null || payload.issue() == null) {
            syncMetrics.recordWebhook("ignored");
            return WebhookResponse.message("Event ignored");
        }

        String action = payload.action() != null ? payload.action() : "";
        if (!SUPPORTED_ACTIONS.contains(action)) {
            log.debug("Ignoring issues action={} for integrationId={}", action, integrationId);
            syncMetrics.recordWebhook("ignored");
            return WebhookResponse.message("Action ignored");
        }

        ActionResult result = syncOrchestrator.handleWebhook(integrationId, action, payload.issue());
        if (!result.success()) {
            log.error("Failed to handle GitHub webhook for integrationId={}: {}", integrationId, result.errorMessage());
            syncMetrics.recordWebhook("failed");
            return WebhookResponse.error(HttpStatus.INTERNAL_SERVER_ERROR,
                    result.errorMessage() != null ? result.errorMessage() : "Webhook processing failed");
        }

        log.info("GitHub webhook processed integrationId={} event={} action={} issue=#{}",
                integrationId, event, action, payload.issue().number());
        syncMetrics.recordWebhook("processed");
        return WebhookResponse.message("Webhook processed");
    }
}
