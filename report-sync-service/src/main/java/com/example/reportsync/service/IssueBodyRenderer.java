package com.example.reportsync.service;

import com.example.reportsync.dto.IssueAttachment;
import com.example.reportsync.entity.Report;
import com.example.reportsync.model.ReportMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders a report as GitHub flavored markdown for the issue body.
 *
 * Sections are only emitted when the widget captured something for them,
 * except the header, description and environment table which are always present.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IssueBodyRenderer {

    private static final DateTimeFormatter ACTIVITY_TIME =
            DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    /**
     * @param attachments resolved attachment URLs, may be empty
     * @param publicBaseUrl base URL of this deployment, null when not configured
     */
    public String render(Report report, List<IssueAttachment> attachments, String publicBaseUrl) {
        ReportMetadata metadata = parseMetadata(report);
        StringBuilder body = new StringBuilder();

        body.append("## Bug Report\n\n");
        body.append("**URL:** ").append(orDefault(metadata.url(), "N/A")).append('\n');
        if (hasText(metadata.title())) {
            body.append("**Page Title:** ").append(metadata.title()).append('\n');
        }
        if (hasText(metadata.referrer())) {
            body.append("**Referrer:** ").append(metadata.referrer()).append('\n');
        }

        body.append("\n### Description\n");
        body.append(hasText(report.getDescription()) ? report.getDescription() : "No description provided.").append('\n');

        appendEnvironment(body, report, metadata);
        appendConsole(body, metadata.consoleErrors());
        appendNetworkErrors(body, metadata.networkErrors());
        appendActivity(body, metadata.userActivity());
        appendStorageKeys(body, metadata.storageKeys());
        appendAttachments(body, attachments);

        if (hasText(publicBaseUrl)) {
            body.append("\n> [View full report](").append(publicBaseUrl)
                    .append("/admin/reports/").append(report.getId()).append(")\n");
        }

        body.append("\n---\n*Reported via the bug report widget*");
        return body.toString();
    }

    private void appendEnvironment(StringBuilder body, Report report, ReportMetadata metadata) {
        ReportMetadata.Browser browser = metadata.browser();
        ReportMetadata.Device device = metadata.device();
        ReportMetadata.Viewport viewport = metadata.viewport();

        String browserText = browser == null ? "Unknown"
                : (orDefault(browser.name(), "Unknown") + " " + orDefault(browser.version(), "")).trim();
        String deviceText = device == null ? "Unknown (Unknown)"
                : orDefault(device.type(), "Unknown") + " (" + orDefault(device.os(), "Unknown")
                + (hasText(device.osVersion()) ? " " + device.osVersion() : "") + ")";
        String viewportText = viewport == null ? "?x?"
                : (viewport.width() != null ? viewport.width() : "?") + "x" + (viewport.height() != null ? viewport.height() : "?");
        String loadTime = metadata.pageLoadTime() != null && metadata.pageLoadTime() > 0
                ? metadata.pageLoadTime() + "ms" : "N/A";
        String timestamp = hasText(metadata.timestamp()) ? metadata.timestamp()
                : (report.getCreatedAt() != null ? report.getCreatedAt().toString() : "N/A");

        body.append("\n### Environment\n")
                .append("| Property | Value |\n")
                .append("|----------|-------|\n")
                .append("| Browser | ").append(browserText).append(" |\n")
                .append("| Device | ").append(deviceText).append(" |\n")
                .append("| Viewport | ").append(viewportText).append(" |\n")
                .append("| Timezone | ").append(orDefault(metadata.timezone(), "Unknown")).append(" |\n")
                .append("| Page Load Time | ").append(loadTime).append(" |\n")
                .append("| Timestamp | ").append(timestamp).append(" |\n")
                .append("| Priority | ").append(report.getPriority() != null ? report.getPriority().name().toLowerCase(Locale.ROOT) : "N/A").append(" |\n");
    }

    private void appendConsole(StringBuilder body, List<ReportMetadata.ConsoleEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        body.append("\n### Console Output (").append(entries.size()).append(")\n");
        for (ReportMetadata.ConsoleEntry entry : entries) {
            body.append("- `[").append(orDefault(entry.type(), "log").toUpperCase(Locale.ROOT)).append("]` ")
                    .append(orDefault(entry.message(), ""));
            if (hasText(entry.source())) {
                body.append(" _(").append(entry.source());
                if (entry.line() != null) {
                    body.append(':').append(entry.line());
                }
                body.append(")_");
            }
            body.append('\n');
        }
    }

    private void appendNetworkErrors(StringBuilder body, List<ReportMetadata.NetworkError> errors) {
        if (errors == null || errors.isEmpty()) {
            return;
        }
        body.append("\n### Network Errors (").append(errors.size()).append(")\n")
                .append("| Status | Method | URL |\n")
                .append("|--------|--------|-----|\n");
        for (ReportMetadata.NetworkError error : errors) {
            String status = error.status() == 0 ? "Failed" : String.valueOf(error.status());
            body.append("| ").append(status).append(' ').append(orDefault(error.statusText(), ""))
                    .append(" | ").append(orDefault(error.method(), ""))
                    .append(" | ").append(orDefault(error.url(), "")).append(" |\n");
        }
    }

    private void appendActivity(StringBuilder body, List<ReportMetadata.UserActivity> activity) {
        if (activity == null || activity.isEmpty()) {
            return;
        }
        body.append("\n### User Activity Trail (").append(activity.size()).append(" events)\n")
                .append("<details>\n<summary>Click to expand</summary>\n\n")
                .append("| Time | Type | Details |\n")
                .append("|------|------|---------|\n");
        for (ReportMetadata.UserActivity event : activity) {
            String type = orDefault(event.type(), "event");
            body.append("| ").append(formatTime(event.timestamp()))
                    .append(" | ").append(type.toUpperCase(Locale.ROOT))
                    .append(" | ").append(activityDetails(type, event)).append(" |\n");
        }
        body.append("\n</details>\n");
    }

    private String activityDetails(String type, ReportMetadata.UserActivity event) {
        String quoted = hasText(event.text()) ? "\"" + event.text() + "\"" : "";
        return switch (type) {
            case "link" -> (quoted + (hasText(event.url()) ? " → " + event.url() : "")).trim();
            case "input" -> (orDefault(event.inputType(), "text") + " " + quoted).trim();
            default -> quoted;
        };
    }

    private void appendStorageKeys(StringBuilder body, ReportMetadata.StorageKeys keys) {
        if (keys == null || keys.total() == 0) {
            return;
        }
        body.append("\n### Storage Keys (").append(keys.total()).append(")\n")
                .append("<details>\n<summary>Click to expand</summary>\n\n");
        appendKeyList(body, "Cookies", keys.cookies());
        appendKeyList(body, "LocalStorage", keys.localStorage());
        appendKeyList(body, "SessionStorage", keys.sessionStorage());
        body.append("</details>\n");
    }

    private void appendKeyList(StringBuilder body, String label, List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return;
        }
        body.append("**").append(label).append(":** `")
                .append(String.join("`, `", keys)).append("`\n\n");
    }

    private void appendAttachments(StringBuilder body, List<IssueAttachment> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return;
        }
        List<IssueAttachment> images = attachments.stream().filter(IssueAttachment::isImage).collect(Collectors.toList());
        List<IssueAttachment> others = attachments.stream().filter(a -> !a.isImage()).collect(Collectors.toList());

        if (!images.isEmpty()) {
            body.append("\n### Screenshots\n");
            for (IssueAttachment image : images) {
                body.append("\n![").append(image.filename()).append("](").append(image.url()).append(")\n");
            }
        }
        if (!others.isEmpty()) {
            body.append("\n### Attachments\n");
            for (IssueAttachment file : others) {
                body.append("- [").append(file.filename()).append("](").append(file.url()).append(")\n");
            }
        }
    }

    private ReportMetadata parseMetadata(Report report) {
        if (!hasText(report.getMetadata())) {
            return ReportMetadata.empty();
        }
        try {
            ReportMetadata metadata = objectMapper.readValue(report.getMetadata(), ReportMetadata.class);
            return metadata != null ? metadata : ReportMetadata.empty();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata on reportId={}, rendering without it: {}", report.getId(), e.getOriginalMessage());
            return ReportMetadata.empty();
        }
    }

    private String formatTime(String timestamp) {
        if (!hasText(timestamp)) {
            return "";
        }
        try {
            return ACTIVITY_TIME.format(Instant.parse(timestamp));
        } catch (DateTimeParseException e) {
            return timestamp;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String orDefault(String value, String fallback) {
        return hasText(value) ? value : fallback;
    }
}
