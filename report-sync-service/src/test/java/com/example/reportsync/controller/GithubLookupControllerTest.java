package com.example.reportsync.controller;

import com.example.reportsync.client.external.GithubClient;
import com.example.reportsync.client.external.GithubClient.GithubClientException;
import com.example.reportsync.client.external.dto.GithubLabelDto;
import com.example.reportsync.client.external.dto.GithubRepositoryDto;
import com.example.reportsync.dto.ConnectionTestResultDto;
import com.example.reportsync.model.GithubIntegrationConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GithubLookupController.class)
class GithubLookupControllerTest {

    private static final String CREDENTIALS = "{\"accessToken\":\"ghp_test\",\"owner\":\"acme\",\"repo\":\"shop\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GithubClient githubClient;

    @Test
    void testTestConnection() throws Exception {
        when(githubClient.testConnection(any())).thenReturn(ConnectionTestResultDto.ok("acme/shop"));

        mockMvc.perform(post("/api/integrations/github/test-connection")
                        .contentType(MediaType.APPLICATION_JSON).content(CREDENTIALS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(jsonPath("$.data.repoName").value("acme/shop"));

        verify(githubClient).testConnection(argThat((GithubIntegrationConfig c) ->
                "acme".equals(c.getOwner()) && "shop".equals(c.getRepo()) && "ghp_test".equals(c.getAccessToken())));
    }

    @Test
    void testRepositories() throws Exception {
        when(githubClient.fetchRepositories("ghp_test")).thenReturn(List.of(
                new GithubRepositoryDto("shop", "acme/shop", new GithubRepositoryDto.Owner("acme"), false)));

        mockMvc.perform(post("/api/integrations/github/repositories")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"accessToken\":\"ghp_test\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].full_name").value("acme/shop"));
    }

    @Test
    void testLookupFailureIsReportedInBody() throws Exception {
        when(githubClient.fetchLabels(any())).thenThrow(new GithubClientException(404, "Repository not found or no access"));

        mockMvc.perform(post("/api/integrations/github/labels")
                        .contentType(MediaType.APPLICATION_JSON).content(CREDENTIALS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Repository not found or no access"));
    }

    @Test
    void testRateLimitedLookupsAreReportedInBody() throws Exception {
        RequestNotPermitted rejected = RequestNotPermitted.createRequestNotPermitted(RateLimiter.ofDefaults("githubRateLimiter"));
        when(githubClient.fetchAssignees(any())).thenThrow(rejected);
        when(githubClient.testConnection(any())).thenThrow(rejected);

        mockMvc.perform(post("/api/integrations/github/assignees")
                        .contentType(MediaType.APPLICATION_JSON).content(CREDENTIALS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(GithubLookupController.RATE_LIMITED_MESSAGE));

        mockMvc.perform(post("/api/integrations/github/test-connection")
                        .contentType(MediaType.APPLICATION_JSON).content(CREDENTIALS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(false))
                .andExpect(jsonPath("$.data.error").value(GithubLookupController.RATE_LIMITED_MESSAGE));
    }

    @Test
    void testLabelsAndAssignees() throws Exception {
        when(githubClient.fetchLabels(any())).thenReturn(List.of(new GithubLabelDto("bug", "d73a4a", null)));

        mockMvc.perform(post("/api/integrations/github/labels")
                        .contentType(MediaType.APPLICATION_JSON).content(CREDENTIALS))
                .andExpect(jsonPath("$.data[0].name").value("bug"));

        when(githubClient.fetchAssignees(any())).thenReturn(List.of());
        mockMvc.perform(post("/api/integrations/github/assignees")
                        .contentType(MediaType.APPLICATION_JSON).content(CREDENTIALS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    void testMissingTokenIsRejected() throws Exception {
        mockMvc.perform(post("/api/integrations/github/repositories")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"owner\":\"acme\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }
}
