package com.example.reportsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Browser context captured by the widget together with a report.
 * Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportMetadata(
        String url,
        String title,
        String referrer,
        String timezone,
        Long pageLoadTime,
        Browser browser,
        Device device,
        Viewport viewport,
        String timestamp,
        List<ConsoleEntry> consoleErrors,
        List<NetworkError> networkErrors,
        List<UserActivity> userActivity,
        StorageKeys storageKeys
) {

    public static ReportMetadata empty() {
        return new ReportMetadata(null, null, null, null, null, null, null, null, null,
                null, null, null, null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Browser(String name, String version) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Device(String type, String os, String osVersion) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Viewport(Integer width, Integer height) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConsoleEntry(String type, String message, String source, Integer line) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NetworkError(String url, String method, int status, String statusText) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserActivity(String type, String text, String url, String inputType, String timestamp) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StorageKeys(List<String> cookies, List<String> localStorage, List<String> sessionStorage) {

        public int total() {
            return size(cookies) + size(localStorage) + size(sessionStorage);
        }

        private static int size(List<String> keys) {
            return keys == null ? 0 : keys.size();
        }
    }
}
