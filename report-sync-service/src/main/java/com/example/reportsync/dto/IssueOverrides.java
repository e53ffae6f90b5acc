package com.example.reportsync.dto;

import java.util.List;

/**
 * Request-time labels/assignees appended to the configured ones.
 */
public record IssueOverrides(List<String> labels, List<String> assignees) {

    public static IssueOverrides none() {
        return new IssueOverrides(List.of(), List.of());
    }
}
