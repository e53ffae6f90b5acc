package com.example.reportsync.exception;

/**
 * Thrown when a report id does not resolve.
 * Maps to 404 REPORT_NOT_FOUND
 */
public class ReportNotFoundException extends RuntimeException {

    private final String reportId;

    public ReportNotFoundException(String reportId) {
        super("Report not found: " + reportId);
        this.reportId = reportId;
    }

    public String getReportId() {
        return reportId;
    }
}
