package com.example.reportsync.client.external;

import com.example.reportsync.client.external.dto.GithubContentDto;
import com.example.reportsync.client.external.dto.GithubHookDto;
import com.example.reportsync.client.external.dto.GithubIssueDto;
import com.example.reportsync.client.external.dto.GithubLabelDto;
import com.example.reportsync.client.external.dto.GithubRepositoryDto;
import com.example.reportsync.client.external.dto.GithubUserDto;
import com.example.reportsync.dto.ConnectionTestResultDto;
import com.example.reportsync.dto.IssueAttachment;
import com.example.reportsync.dto.IssueOverrides;
import com.example.reportsync.dto.IssueRef;
import com.example.reportsync.entity.FileType;
import com.example.reportsync.entity.Report;
import com.example.reportsync.entity.ReportFile;
import com.example.reportsync.model.FileTransferMode;
import com.example.reportsync.model.GithubIntegrationConfig;
import com.example.reportsync.service.IssueBodyRenderer;
import com.example.reportsync.store.FileStore;
import com.example.reportsync.store.SettingsProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Client for the GitHub REST API (issues, webhooks, lookups, attachment uploads).
 *
 * CRITICAL DESIGN:
 * - No retry of its own: the orchestrator and the sync queue decide about retries
 * - Must be called OUTSIDE @Transactional
 * - Every failure surfaces as {@link GithubClientException}, network errors included
 * - Rate limited client side (githubRateLimiter) to stay below 5000 req/hour
 */
@Component
@Slf4j
public class GithubClient {

    static final String ATTACHMENT_DIR = ".report-sync/attachments";
    private static final int REPOSITORY_PAGE_LIMIT = 5;
    private static final String INCOMPLETE_CONFIG = "GitHub configuration incomplete. Required: owner, repo, accessToken";

    private final WebClient githubWebClient;
    private final IssueBodyRenderer issueBodyRenderer;
    private final FileStore fileStore;
    private final SettingsProvider settingsProvider;
    private final ObjectMapper objectMapper;
    private final long maxUploadBytes;
    private final Duration timeout;

    public GithubClient(@Qualifier("githubWebClient") WebClient githubWebClient,
                        IssueBodyRenderer issueBodyRenderer,
                        FileStore fileStore,
                        SettingsProvider settingsProvider,
                        ObjectMapper objectMapper,
                        @Value("${report-sync.attachments.max-upload-bytes:10485760}") long maxUploadBytes,
                        @Value("${report-sync.github.timeout-seconds:20}") long timeoutSeconds) {
        this.githubWebClient = githubWebClient;
        this.issueBodyRenderer = issueBodyRenderer;
        this.fileStore = fileStore;
        this.settingsProvider = settingsProvider;
        this.objectMapper = objectMapper;
        this.maxUploadBytes = maxUploadBytes;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * Create an issue for the report.
     * Configured labels/assignees come first, request-time ones are appended as-is.
     */
    @RateLimiter(name = "githubRateLimiter")
    public IssueRef createIssue(Report report, GithubIntegrationConfig config, IssueOverrides overrides) {
        requireComplete(config);
        String body = renderBody(report, config);

        List<String> labels = merge(config.getLabels(), overrides != null ? overrides.labels() : null);
        List<String> assignees = merge(config.getAssignees(), overrides != null ? overrides.assignees() : null);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("title", report.getTitle());
        request.put("body", body);
        if (!labels.isEmpty()) {
            request.put("labels", labels);
        }
        if (!assignees.isEmpty()) {
            request.put("assignees", assignees);
        }

        GithubIssueDto issue = call("create issue", () -> githubWebClient.post()
                .uri("/repos/{owner}/{repo}/issues", config.getOwner(), config.getRepo())
                .headers(h -> authorize(h, config.getAccessToken()))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, Map.of()))
                .bodyToMono(GithubIssueDto.class)
                .timeout(timeout)
                .block());

        log.info("Created GitHub issue #{} in {} for reportId={}", issue.number(), config.fullName(), report.getId());
        return new IssueRef(issue.number(), issue.htmlUrl());
    }

    /**
     * Re-render the issue and align its state: resolved/closed reports close the issue, anything else reopens it.
     */
    @RateLimiter(name = "githubRateLimiter")
    public IssueRef updateIssue(int issueNumber, Report report, GithubIntegrationConfig config) {
        requireComplete(config);
        String body = renderBody(report, config);
        String state = report.getStatus() != null && report.getStatus().isFinished() ? "closed" : "open";

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("title", report.getTitle());
        request.put("body", body);
        request.put("state", state);

        GithubIssueDto issue = call("update issue", () -> githubWebClient.patch()
                .uri("/repos/{owner}/{repo}/issues/{number}", config.getOwner(), config.getRepo(), issueNumber)
                .headers(h -> authorize(h, config.getAccessToken()))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, Map.of()))
                .bodyToMono(GithubIssueDto.class)
                .timeout(timeout)
                .block());

        log.info("Updated GitHub issue #{} in {} for reportId={} state={}", issue.number(), config.fullName(), report.getId(), state);
        return new IssueRef(issue.number(), issue.htmlUrl());
    }

    @RateLimiter(name = "githubRateLimiter")
    public GithubIssueDto getIssue(int issueNumber, GithubIntegrationConfig config) {
        requireComplete(config);
        return call("get issue", () -> githubWebClient.get()
                .uri("/repos/{owner}/{repo}/issues/{number}", config.getOwner(), config.getRepo(), issueNumber)
                .headers(h -> authorize(h, config.getAccessToken()))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, Map.of(404, "Issue not found")))
                .bodyToMono(GithubIssueDto.class)
                .timeout(timeout)
                .block());
    }

    /**
     * Check that the token can see the repository.
     * GitHub failures come back as a failed result with a message the admin UI can show as-is;
     * a rate limiter rejection is thrown before this method runs.
     */
    @RateLimiter(name = "githubRateLimiter")
    public ConnectionTestResultDto testConnection(GithubIntegrationConfig config) {
        if (!isComplete(config)) {
            return ConnectionTestResultDto.failed("Missing required fields: owner, repo, accessToken");
        }
        try {
            GithubRepositoryDto repository = call("test connection", () -> githubWebClient.get()
                    .uri("/repos/{owner}/{repo}", config.getOwner(), config.getRepo())
                    .headers(h -> authorize(h, config.getAccessToken()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> toException(response, Map.of(
                            404, "Repository not found or no access",
                            401, "Invalid access token")))
                    .bodyToMono(GithubRepositoryDto.class)
                    .timeout(timeout)
                    .block());
            log.info("GitHub connection test succeeded for {}", repository.fullName());
            return ConnectionTestResultDto.ok(repository.fullName());
        } catch (GithubClientException e) {
            log.warn("GitHub connection test failed for {}: {}", config.fullName(), e.getMessage());
            return ConnectionTestResultDto.failed(e.getMessage());
        }
    }

    /**
     * Register a repository webhook that delivers issue events only.
     *
     * @return the remote webhook id
     */
    @RateLimiter(name = "githubRateLimiter")
    public String createWebhook(GithubIntegrationConfig config, String callbackUrl, String secret) {
        requireComplete(config);

        Map<String, Object> hookConfig = new LinkedHashMap<>();
        hookConfig.put("url", callbackUrl);
        hookConfig.put("content_type", "json");
        hookConfig.put("secret", secret);
        hookConfig.put("insecure_ssl", "0");

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("name", "web");
        request.put("active", true);
        request.put("events", List.of("issues"));
        request.put("config", hookConfig);

        GithubHookDto hook = call("create webhook", () -> githubWebClient.post()
                .uri("/repos/{owner}/{repo}/hooks", config.getOwner(), config.getRepo())
                .headers(h -> authorize(h, config.getAccessToken()))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, Map.of(
                        404, "Repository not found or token lacks admin:repo_hook permission",
                        422, "Webhook already exists or validation failed")))
                .bodyToMono(GithubHookDto.class)
                .timeout(timeout)
                .block());
        if (hook == null) {
            throw new GithubClientException(502, "GitHub returned no webhook in the create response");
        }

        log.info("Created GitHub webhook id={} on {} -> {}", hook.id(), config.fullName(), callbackUrl);
        return String.valueOf(hook.id());
    }

    /**
     * Remove a webhook. A webhook that is already gone counts as removed.
     */
    @RateLimiter(name = "githubRateLimiter")
    public void deleteWebhook(GithubIntegrationConfig config, String webhookId) {
        requireComplete(config);
        call("delete webhook", () -> githubWebClient.delete()
                .uri("/repos/{owner}/{repo}/hooks/{hookId}", config.getOwner(), config.getRepo(), webhookId)
                .headers(h -> authorize(h, config.getAccessToken()))
                .retrieve()
                .onStatus(status -> status.value() == 404, response -> {
                    log.info("GitHub webhook id={} on {} was already removed", webhookId, config.fullName());
                    return Mono.empty();
                })
                .onStatus(HttpStatusCode::isError, response -> toException(response, Map.of()))
                .toBodilessEntity()
                .timeout(timeout)
                .block());
        log.info("Deleted GitHub webhook id={} on {}", webhookId, config.fullName());
    }

    /**
     * Repositories the token can access, sorted by full name.
     * Stops after {@value #REPOSITORY_PAGE_LIMIT} pages of 100, on an empty page or when there is no next page.
     */
    @RateLimiter(name = "githubRateLimiter")
    public List<GithubRepositoryDto> fetchRepositories(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new GithubClientException(0, "Access token is required");
        }
        List<GithubRepositoryDto> repositories = new ArrayList<>();
        for (int page = 1; page <= REPOSITORY_PAGE_LIMIT; page++) {
            int currentPage = page;
            ResponseEntity<List<GithubRepositoryDto>> response = call("list repositories", () -> githubWebClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/user/repos")
                            .queryParam("per_page", 100)
                            .queryParam("page", currentPage)
                            .queryParam("sort", "full_name")
                            .queryParam("affiliation", "owner,collaborator,organization_member")
                            .build())
                    .headers(h -> authorize(h, accessToken))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, r -> toException(r, Map.of(
                            401, "Invalid access token",
                            403, "Token does not have permission to list repositories")))
                    .toEntity(new ParameterizedTypeReference<List<GithubRepositoryDto>>() {})
                    .timeout(timeout)
                    .block());

            List<GithubRepositoryDto> batch = response.getBody();
            if (batch == null || batch.isEmpty()) {
                break;
            }
            repositories.addAll(batch);

            String link = response.getHeaders().getFirst(HttpHeaders.LINK);
            if (link == null || !link.contains("rel=\"next\"")) {
                break;
            }
        }
        log.debug("Fetched {} GitHub repositories", repositories.size());
        return repositories;
    }

    @RateLimiter(name = "githubRateLimiter")
    public List<GithubLabelDto> fetchLabels(GithubIntegrationConfig config) {
        requireLookupFields(config);
        return call("list labels", () -> githubWebClient.get()
                .uri("/repos/{owner}/{repo}/labels?per_page=100", config.getOwner(), config.getRepo())
                .headers(h -> authorize(h, config.getAccessToken()))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, Map.of(404, "Repository not found or no access")))
                .bodyToMono(new ParameterizedTypeReference<List<GithubLabelDto>>() {})
                .timeout(timeout)
                .defaultIfEmpty(List.of())
                .block());
    }

    @RateLimiter(name = "githubRateLimiter")
    public List<GithubUserDto> fetchAssignees(GithubIntegrationConfig config) {
        requireLookupFields(config);
        return call("list assignees", () -> githubWebClient.get()
                .uri("/repos/{owner}/{repo}/assignees?per_page=100", config.getOwner(), config.getRepo())
                .headers(h -> authorize(h, config.getAccessToken()))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toException(response, Map.of(404, "Repository not found or no access")))
                .bodyToMono(new ParameterizedTypeReference<List<GithubUserDto>>() {})
                .timeout(timeout)
                .defaultIfEmpty(List.of())
                .block());
    }

    private String renderBody(Report report, GithubIntegrationConfig config) {
        String baseUrl = settingsProvider.getPublicBaseUrl().orElse(null);
        List<IssueAttachment> attachments = resolveAttachments(report, config, baseUrl);
        return issueBodyRenderer.render(report, attachments, baseUrl);
    }

    /**
     * Work out the URL of every attachment.
     *
     * In upload mode files go to the repository under {@value #ATTACHMENT_DIR}/&lt;report id&gt;/.
     * Videos and oversized files are not uploaded, and a 403 stops all further uploads
     * for this report. Anything not uploaded falls back to a public link when a base URL exists.
     */
    List<IssueAttachment> resolveAttachments(Report report, GithubIntegrationConfig config, String baseUrl) {
        List<ReportFile> files = fileStore.findByReport(report.getId());
        if (files.isEmpty()) {
            return List.of();
        }

        boolean upload = config.effectiveFileTransferMode() == FileTransferMode.UPLOAD;
        boolean uploadsDenied = false;
        List<IssueAttachment> attachments = new ArrayList<>();

        for (ReportFile file : files) {
            String url = null;
            if (upload && !uploadsDenied && isUploadable(file)) {
                try {
                    url = uploadAttachment(report.getId(), file, config);
                } catch (GithubClientException e) {
                    if (e.getStatus() == 403) {
                        uploadsDenied = true;
                        log.warn("GitHub denied attachment upload for reportId={}, skipping remaining uploads: {}",
                                report.getId(), e.getMessage());
                    } else {
                        log.warn("Failed to upload attachment {} for reportId={}: {}",
                                file.getFilename(), report.getId(), e.getMessage());
                    }
                } catch (IOException e) {
                    log.warn("Cannot read attachment {} for reportId={}: {}", file.getFilename(), report.getId(), e.getMessage());
                }
            }
            if (url == null && baseUrl != null) {
                url = baseUrl + "/api/public/files/" + report.getId() + "/" + file.getFilename();
            }
            if (url != null) {
                attachments.add(new IssueAttachment(file.getFilename(), file.getType(), url));
            }
        }
        return attachments;
    }

    private boolean isUploadable(ReportFile file) {
        if (file.getType() == FileType.VIDEO) {
            return false;
        }
        if (file.getSizeBytes() > maxUploadBytes) {
            log.debug("Attachment {} exceeds upload ceiling ({} > {} bytes)", file.getFilename(), file.getSizeBytes(), maxUploadBytes);
            return false;
        }
        return true;
    }

    private String uploadAttachment(String reportId, ReportFile file, GithubIntegrationConfig config) throws IOException {
        Optional<GithubContentDto> existing = findContent(reportId, file.getFilename(), config);
        if (existing.isPresent()) {
            log.debug("Reusing uploaded attachment {} for reportId={}", file.getFilename(), reportId);
            return existing.get().embeddableUrl();
        }

        byte[] bytes = fileStore.read(file);
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("message", "Add attachment " + file.getFilename() + " for report " + reportId);
        request.put("content", Base64.getEncoder().encodeToString(bytes));

        GithubContentDto.UploadResponse response = call("upload attachment", () -> githubWebClient.put()
                .uri("/repos/{owner}/{repo}/contents/" + ATTACHMENT_DIR + "/{reportId}/{filename}",
                        config.getOwner(), config.getRepo(), reportId, file.getFilename())
                .headers(h -> authorize(h, config.getAccessToken()))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> toException(r, Map.of()))
                .bodyToMono(GithubContentDto.UploadResponse.class)
                .timeout(timeout)
                .block());

        log.info("Uploaded attachment {} ({} bytes) to {} for reportId={}", file.getFilename(), bytes.length, config.fullName(), reportId);
        return response.content().embeddableUrl();
    }

    private Optional<GithubContentDto> findContent(String reportId, String filename, GithubIntegrationConfig config) {
        GithubContentDto content = call("find attachment", () -> githubWebClient.get()
                .uri("/repos/{owner}/{repo}/contents/" + ATTACHMENT_DIR + "/{reportId}/{filename}",
                        config.getOwner(), config.getRepo(), reportId, filename)
                .headers(h -> authorize(h, config.getAccessToken()))
                .retrieve()
                .onStatus(status -> status.value() == 404, r -> Mono.error(new ContentMissing()))
                .onStatus(HttpStatusCode::isError, r -> toException(r, Map.of()))
                .bodyToMono(GithubContentDto.class)
                .timeout(timeout)
                .onErrorResume(ContentMissing.class, e -> Mono.empty())
                .block());
        return Optional.ofNullable(content);
    }

    private static void authorize(HttpHeaders headers, String accessToken) {
        headers.setBearerAuth(accessToken);
        headers.set(HttpHeaders.ACCEPT, "application/vnd.github+json");
        headers.set("X-GitHub-Api-Version", "2022-11-28");
    }

    /**
     * Turn an error response into a GithubClientException, using a fixed message for the
     * statuses the caller knows how to explain and the API's own message otherwise.
     */
    private Mono<? extends Throwable> toException(ClientResponse response, Map<Integer, String> knownStatuses) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    String known = knownStatuses.get(status);
                    String message = known != null ? known : "GitHub API error: " + extractMessage(body, status);
                    log.error("GitHub API responded {}: {}", status, message);
                    return new GithubClientException(status, message);
                });
    }

    private String extractMessage(String body, int status) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                if (node.hasNonNull("message")) {
                    return node.get("message").asText();
                }
            } catch (IOException e) {
                log.debug("GitHub error body is not JSON: {}", e.getMessage());
            }
        }
        return "HTTP " + status;
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (GithubClientException e) {
            throw e;
        } catch (Exception e) {
            log.error("GitHub {} failed: {}", operation, e.getMessage());
            throw new GithubClientException(0, "GitHub request failed: " + e.getMessage(), e);
        }
    }

    private static List<String> merge(List<String> configured, List<String> requested) {
        List<String> merged = new ArrayList<>();
        if (configured != null) {
            merged.addAll(configured);
        }
        if (requested != null) {
            merged.addAll(requested);
        }
        return merged;
    }

    private static boolean isComplete(GithubIntegrationConfig config) {
        return config != null && hasText(config.getOwner()) && hasText(config.getRepo()) && hasText(config.getAccessToken());
    }

    private static void requireComplete(GithubIntegrationConfig config) {
        if (!isComplete(config)) {
            throw new GithubClientException(0, INCOMPLETE_CONFIG);
        }
    }

    private static void requireLookupFields(GithubIntegrationConfig config) {
        if (!isComplete(config)) {
            throw new GithubClientException(0, "Access token, owner, and repo are required");
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Failure talking to GitHub. status is the HTTP status, or 0 when no response was received.
     */
    public static class GithubClientException extends RuntimeException {

        private final int status;

        public GithubClientException(int status, String message) {
            super(message);
            this.status = status;
        }

        public GithubClientException(int status, String message, Throwable cause) {
            super(message, cause);
            this.status = status;
        }

        public int getStatus() {
            return status;
        }
    }

    /**
     * Marker for a 404 on the contents API, which only means "not uploaded yet".
     */
    private static class ContentMissing extends RuntimeException {
        ContentMissing() {
            super(null, null, false, false);
        }
    }
}
