package com.example.reportsync.dto;

/**
 * Remote issue created or updated by the tracker client.
 */
public record IssueRef(int issueNumber, String issueUrl) {}
