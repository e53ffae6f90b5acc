package com.example.reportsync.dto;

import lombok.Builder;

import java.util.List;

@Builder
public record BatchSyncResultDto(
        int total,
        int successful,
        int failed,
        List<SyncResultDto> results
) {}
