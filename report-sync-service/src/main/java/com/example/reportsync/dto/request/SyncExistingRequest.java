package com.example.reportsync.dto.request;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * reportIds is either an array of report ids or the string "all".
 */
public record SyncExistingRequest(JsonNode reportIds) {}
