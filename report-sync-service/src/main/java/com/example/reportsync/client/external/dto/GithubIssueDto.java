package com.example.reportsync.client.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GithubIssueDto(
        int number,
        String state,
        String title,
        String body,
        @JsonProperty("html_url") String htmlUrl
) {}
