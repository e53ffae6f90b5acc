package com.example.reportsync.dto;

import com.example.reportsync.model.SyncErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of pushing one report to the tracker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncResultDto {

    private String reportId;
    private boolean success;
    private Integer issueNumber;
    private String issueUrl;
    private SyncErrorCode errorCode;
    private String errorMessage;

    public static SyncResultDto synced(String reportId, int issueNumber, String issueUrl) {
        return SyncResultDto.builder()
                .reportId(reportId)
                .success(true)
                .issueNumber(issueNumber)
                .issueUrl(issueUrl)
                .build();
    }

    public static SyncResultDto failed(String reportId, SyncErrorCode code, String message) {
        return SyncResultDto.builder()
                .reportId(reportId)
                .success(false)
                .errorCode(code)
                .errorMessage(message)
                .build();
    }

    public boolean isRetryable() {
        return !success && errorCode != null && errorCode.isRetryable();
    }
}
