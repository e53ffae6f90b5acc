package com.example.reportsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * MANUAL: reports are pushed only when someone asks.
 * AUTOMATIC: new/changed reports are queued and tracker issue events flow back via webhook.
 */
public enum SyncMode {
    MANUAL,
    AUTOMATIC;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SyncMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MANUAL;
        }
        return SyncMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
