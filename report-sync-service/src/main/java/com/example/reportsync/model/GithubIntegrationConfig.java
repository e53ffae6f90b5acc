package com.example.reportsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * GitHub variant of the integration config, stored as JSON on the integration row.
 * webhookId/webhookSecret are only present while automatic sync is active.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GithubIntegrationConfig implements IssueTrackerConfig {

    private String owner;
    private String repo;

    @ToString.Exclude
    private String accessToken;

    private List<String> labels;
    private List<String> assignees;
    private SyncMode syncMode;
    private String webhookId;

    @ToString.Exclude
    private String webhookSecret;

    private FileTransferMode fileTransferMode;

    public FileTransferMode effectiveFileTransferMode() {
        return fileTransferMode != null ? fileTransferMode : FileTransferMode.LINK;
    }

    public String fullName() {
        return owner + "/" + repo;
    }
}
