package com.example.reportsync.entity;

/**
 * Discriminant of the integration config variant.
 * Only GITHUB is handled by the sync engine; the others belong to
 * forwarding features outside this service.
 */
public enum IntegrationType {
    GITHUB,
    JIRA,
    SLACK
}
