package com.example.reportsync.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Credentials typed into the integration dialog before the integration is saved.
 * owner/repo are not needed for the repository listing.
 */
public record GithubLookupRequest(
        @NotBlank(message = "accessToken is required") String accessToken,
        String owner,
        String repo
) {

    @Override
    public String toString() {
        return "GithubLookupRequest[owner=" + owner + ", repo=" + repo + "]";
    }
}
