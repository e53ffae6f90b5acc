package com.example.reportsync.webhook;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * What the webhook endpoint answers to GitHub: a status and a one-field JSON body.
 */
public record WebhookResponse(HttpStatus status, Map<String, String> body) {

    public static WebhookResponse message(String message) {
        return new WebhookResponse(HttpStatus.OK, Map.of("message", message));
    }

    public static WebhookResponse error(HttpStatus status, String error) {
        return new WebhookResponse(status, Map.of("error", error));
    }
}
