package com.example.reportsync.dto;

public record QueuedResponse(int queued, String message) {}
