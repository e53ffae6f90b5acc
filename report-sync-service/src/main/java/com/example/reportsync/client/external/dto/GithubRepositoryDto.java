package com.example.reportsync.client.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GithubRepositoryDto(
        String name,
        @JsonProperty("full_name") String fullName,
        Owner owner,
        @JsonProperty("private") boolean isPrivate
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Owner(String login) {}
}
