package com.example.reportsync.controller;

import com.example.reportsync.client.external.GithubClient;
import com.example.reportsync.client.external.GithubClient.GithubClientException;
import com.example.reportsync.dto.ConnectionTestResultDto;
import com.example.reportsync.dto.request.GithubLookupRequest;
import com.example.reportsync.model.GithubIntegrationConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.function.Supplier;

/**
 * GitHub lookups for the integration dialog, before an integration is saved.
 *
 * Failures of the GitHub call are answered with 200 and {success:false, error} so the dialog
 * can show GitHub's message next to the field.
 */
@RestController
@RequestMapping("/api/integrations/github")
@RequiredArgsConstructor
@Slf4j
public class GithubLookupController {

    static final String RATE_LIMITED_MESSAGE = "GitHub rate limit reached, try again in a minute";

    private final GithubClient githubClient;

    @PostMapping("/test-connection")
    public ResponseEntity<Map<String, Object>> testConnection(@Valid @RequestBody GithubLookupRequest request) {
        ConnectionTestResultDto result;
        try {
            result = githubClient.testConnection(toConfig(request));
        } catch (RequestNotPermitted e) {
            log.warn("⚠️ GitHub connection test rejected by rate limiter: {}", e.getMessage());
            result = ConnectionTestResultDto.failed(RATE_LIMITED_MESSAGE);
        }
        return ResponseEntity.ok(Map.of(
                "data", result,
                "timestamp", Instant.now().toString()
        ));
    }

    @PostMapping("/repositories")
    public ResponseEntity<Map<String, Object>> repositories(@Valid @RequestBody GithubLookupRequest request) {
        return lookup("repositories", () -> githubClient.fetchRepositories(request.accessToken()));
    }

    @PostMapping("/labels")
    public ResponseEntity<Map<String, Object>> labels(@Valid @RequestBody GithubLookupRequest request) {
        return lookup("labels", () -> githubClient.fetchLabels(toConfig(request)));
    }

    @PostMapping("/assignees")
    public ResponseEntity<Map<String, Object>> assignees(@Valid @RequestBody GithubLookupRequest request) {
        return lookup("assignees", () -> githubClient.fetchAssignees(toConfig(request)));
    }

    private ResponseEntity<Map<String, Object>> lookup(String what, Supplier<Object> call) {
        try {
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "data", call.get(),
                    "timestamp", Instant.now().toString()
            ));
        } catch (GithubClientException e) {
            log.warn("⚠️ GitHub {} lookup failed: status={}, error={}", what, e.getStatus(), e.getMessage());
            return lookupFailed(e.getMessage());
        } catch (RequestNotPermitted e) {
            log.warn("⚠️ GitHub {} lookup rejected by rate limiter: {}", what, e.getMessage());
            return lookupFailed(RATE_LIMITED_MESSAGE);
        }
    }

    private static ResponseEntity<Map<String, Object>> lookupFailed(String error) {
        return ResponseEntity.ok(Map.of(
                "success", false,
                "error", error,
                "timestamp", Instant.now().toString()
        ));
    }

    private static GithubIntegrationConfig toConfig(GithubLookupRequest request) {
        return GithubIntegrationConfig.builder()
                .owner(request.owner())
                .repo(request.repo())
                .accessToken(request.accessToken())
                .build();
    }
}
