package com.example.reportsync.model;

/**
 * Capabilities every issue-tracker integration variant exposes to the sync engine.
 * The concrete variant is chosen by the integration type.
 */
public interface IssueTrackerConfig {

    SyncMode getSyncMode();

    String getWebhookId();

    String getWebhookSecret();

    default SyncMode effectiveSyncMode() {
        return getSyncMode() != null ? getSyncMode() : SyncMode.MANUAL;
    }
}
