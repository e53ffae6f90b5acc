package com.example.reportsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How attachments end up in the issue body: linked to our public file
 * endpoint, or uploaded into the tracker repository.
 */
public enum FileTransferMode {
    LINK,
    UPLOAD;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FileTransferMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return LINK;
        }
        return FileTransferMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
