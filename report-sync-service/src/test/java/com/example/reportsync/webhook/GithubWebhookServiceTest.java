package com.example.reportsync.webhook;

import com.example.reportsync.client.external.dto.GithubIssueDto;
import com.example.reportsync.dto.ActionResult;
import com.example.reportsync.entity.Integration;
import com.example.reportsync.entity.IntegrationType;
import com.example.reportsync.metrics.SyncMetrics;
import com.example.reportsync.model.SyncErrorCode;
import com.example.reportsync.service.SyncOrchestrator;
import com.example.reportsync.store.IntegrationConfigMapper;
import com.example.reportsync.support.InMemoryIntegrationStore;
import com.example.reportsync.support.TestData;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GithubWebhookServiceTest {

    private static final String SECRET = "whsec_0123456789abcdef0123456789ab";
    private static final String CLOSED_EVENT =
            "{\"action\":\"closed\",\"issue\":{\"number\":123,\"state\":\"closed\",\"title\":\"t\"},\"repository\":{\"id\":1}}";

    private InMemoryIntegrationStore integrationStore;
    private SyncOrchestrator orchestrator;
    private SimpleMeterRegistry meterRegistry;
    private GithubWebhookService service;

    @BeforeEach
    void setUp() {
        integrationStore = new InMemoryIntegrationStore();
        orchestrator = mock(SyncOrchestrator.class);
        meterRegistry = new SimpleMeterRegistry();
        ObjectMapper objectMapper = new ObjectMapper();
        service = new GithubWebhookService(integrationStore, new IntegrationConfigMapper(objectMapper),
                new WebhookSignatureVerifier(), orchestrator, objectMapper, new SyncMetrics(meterRegistry));

        integrationStore.create(TestData.githubIntegration("int_1",
                "{\"owner\":\"acme\",\"repo\":\"shop\",\"accessToken\":\"t\",\"syncMode\":\"automatic\","
                        + "\"webhookId\":\"9\",\"webhookSecret\":\"" + SECRET + "\"}"));
        when(orchestrator.handleWebhook(anyString(), anyString(), any(GithubIssueDto.class)))
                .thenReturn(ActionResult.ok());
    }

    private WebhookResponse deliver(String integrationId, String event, String body, String secret) {
        byte[] raw = body.getBytes(StandardCharsets.UTF_8);
        String signature = secret != null ? WebhookSignatureVerifier.sign(raw, secret) : null;
        return service.handle(integrationId, event, "delivery-1", signature, raw);
    }

    private double webhookCount(String outcome) {
        return meterRegistry.get("webhook_deliveries_total").tag("outcome", outcome).counter().count();
    }

    @Test
    void testHandle_SignedClosedEventIsDispatched() {
        WebhookResponse response = deliver("int_1", "issues", CLOSED_EVENT, SECRET);

        assertThat(response.status()).isEqualTo(HttpStatus.OK);
        assertThat(response.body()).containsEntry("message", "Webhook processed");
        verify(orchestrator).handleWebhook(eq("int_1"), eq("closed"),
                eq(new GithubIssueDto(123, "closed", "t", null, null)));
        assertThat(webhookCount("processed")).isEqualTo(1.0);
    }

    @Test
    void testHandle_UnknownIntegrationIs404() {
        WebhookResponse response = deliver("nope", "issues", CLOSED_EVENT, SECRET);

        assertThat(response.status()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.body()).containsEntry("error", "Integration not found");
    }

    @Test
    void testHandle_NonGithubIntegrationIs400() {
        Integration jira = TestData.githubIntegration("int_jira", "{}");
        jira.setType(IntegrationType.JIRA);
        integrationStore.create(jira);

        WebhookResponse response = deliver("int_jira", "issues", CLOSED_EVENT, SECRET);

        assertThat(response.status()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.body()).containsEntry("error", "Invalid integration type");
    }

    @Test
    void testHandle_MissingAndInvalidSignatureAre401() {
        WebhookResponse missing = deliver("int_1", "issues", CLOSED_EVENT, null);
        WebhookResponse invalid = deliver("int_1", "issues", CLOSED_EVENT, "wrong-secret");

        assertThat(missing.status()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(missing.body()).containsEntry("error", "Missing signature");
        assertThat(invalid.status()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(invalid.body()).containsEntry("error", "Invalid signature");
        verify(orchestrator, never()).handleWebhook(anyString(), anyString(), any());
        assertThat(webhookCount("unauthorized")).isEqualTo(2.0);
    }

    @Test
    void testHandle_SignatureCheckedBeforeJsonParsing() {
        WebhookResponse unsigned = deliver("int_1", "issues", "{broken", null);
        WebhookResponse signed = deliver("int_1", "issues", "{broken", SECRET);

        assertThat(unsigned.status()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(signed.status()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(signed.body()).containsEntry("error", "Invalid JSON");
    }

    @Test
    void testHandle_NoSecretSkipsSignatureCheck() {
        integrationStore.create(TestData.githubIntegration("int_open", TestData.githubConfig()));

        WebhookResponse response = deliver("int_open", "issues", CLOSED_EVENT, null);

        assertThat(response.status()).isEqualTo(HttpStatus.OK);
        verify(orchestrator).handleWebhook(eq("int_open"), eq("closed"), any(GithubIssueDto.class));
    }

    @Test
    void testHandle_PingAnswersPong() {
        WebhookResponse response = deliver("int_1", "ping", "{\"zen\":\"Keep it logically awesome.\"}", SECRET);

        assertThat(response.status()).isEqualTo(HttpStatus.OK);
        assertThat(response.body()).containsEntry("message", "pong");
    }

    @Test
    void testHandle_OtherEventsAndActionsAreIgnored() {
        WebhookResponse push = deliver("int_1", "push", "{\"ref\":\"refs/heads/main\"}", SECRET);
        WebhookResponse labeled = deliver("int_1", "issues",
                "{\"action\":\"labeled\",\"issue\":{\"number\":1,\"state\":\"open\"}}", SECRET);
        WebhookResponse noIssue = deliver("int_1", "issues", "{\"action\":\"closed\"}", SECRET);

        assertThat(push.body()).containsEntry("message", "Event ignored");
        assertThat(labeled.body()).containsEntry("message", "Action ignored");
        assertThat(noIssue.body()).containsEntry("message", "Event ignored");
        assertThat(push.status()).isEqualTo(HttpStatus.OK);
        verify(orchestrator, never()).handleWebhook(anyString(), anyString(), any());
        assertThat(webhookCount("ignored")).isEqualTo(3.0);
    }

    @Test
    void testHandle_DispatchFailureIs500() {
        when(orchestrator.handleWebhook(anyString(), anyString(), any(GithubIssueDto.class)))
                .thenReturn(ActionResult.fail(SyncErrorCode.SYNC_FAILED, "connection refused"));

        WebhookResponse response = deliver("int_1", "issues", CLOSED_EVENT, SECRET);

        assertThat(response.status()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.body()).containsEntry("error", "connection refused");
    }
}
