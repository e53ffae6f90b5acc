package com.example.reportsync.dto;

import lombok.Builder;

/**
 * Error envelope of the admin API.
 */
@Builder
public record ErrorResponse(
        Error error,
        String timestamp
) {

    @Builder
    public record Error(
            String code,
            String message,
            String field,
            Object details
    ) {}
}
