package com.example.reportsync.dto.request;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record SyncReportsRequest(@NotEmpty(message = "reportIds must not be empty") List<String> reportIds) {}
