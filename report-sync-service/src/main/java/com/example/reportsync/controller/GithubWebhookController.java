package com.example.reportsync.controller;

import com.example.reportsync.webhook.GithubWebhookService;
import com.example.reportsync.webhook.WebhookResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives GitHub issue events.
 *
 * The body is taken as raw bytes: the signature is computed over exactly what GitHub sent,
 * so it must not go through Jackson first.
 */
@RestController
@RequestMapping("/api/webhooks/github")
@RequiredArgsConstructor
@Slf4j
public class GithubWebhookController {

    private final GithubWebhookService webhookService;

    @PostMapping("/{integrationId}")
    public ResponseEntity<Map<String, String>> receive(
            @PathVariable String integrationId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestHeader(value = "X-GitHub-Event", required = false) String event,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestBody(required = false) byte[] body) {

        if (deliveryId != null && !deliveryId.isBlank()) {
            MDC.put("correlationId", "WEBHOOK-" + deliveryId);
        }

        WebhookResponse response = webhookService.handle(
                integrationId, event, deliveryId, signature, body != null ? body : new byte[0]);
        return ResponseEntity.status(response.status()).body(response.body());
    }
}
