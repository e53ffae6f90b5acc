package com.example.reportsync.webhook;

import com.example.reportsync.client.external.dto.GithubIssueDto;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The parts of a GitHub event payload the sync engine reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GithubWebhookPayload(String action, GithubIssueDto issue) {}
