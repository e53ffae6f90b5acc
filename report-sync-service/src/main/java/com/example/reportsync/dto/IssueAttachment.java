package com.example.reportsync.dto;

import com.example.reportsync.entity.FileType;

/**
 * An attachment as it appears in the issue body: either uploaded to the
 * tracker or linked to this deployment.
 */
public record IssueAttachment(String filename, FileType type, String url) {

    public boolean isImage() {
        return type == FileType.SCREENSHOT;
    }
}
