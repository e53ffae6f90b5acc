package com.example.reportsync.client.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A file in the repository, as returned by the contents API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GithubContentDto(
        String name,
        String path,
        String sha,
        @JsonProperty("html_url") String htmlUrl,
        @JsonProperty("download_url") String downloadUrl
) {

    /**
     * Link that renders inline in issue markdown, also for private repositories.
     */
    public String embeddableUrl() {
        return htmlUrl + "?raw=true";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UploadResponse(GithubContentDto content) {}
}
