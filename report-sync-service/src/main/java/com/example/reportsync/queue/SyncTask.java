package com.example.reportsync.queue;

import lombok.Getter;

import java.time.Instant;

/**
 * One queued "push this report" job. Mutable fields are only touched under the queue lock.
 */
@Getter
public class SyncTask {

    private final String id;
    private final String reportId;
    private final String integrationId;
    private final Instant createdAt;
    private int attempts;
    private Instant nextAttempt;

    SyncTask(String reportId, String integrationId, Instant now) {
        this.id = reportId + "-" + now.toEpochMilli();
        this.reportId = reportId;
        this.integrationId = integrationId;
        this.createdAt = now;
        this.attempts = 0;
        this.nextAttempt = now;
    }

    boolean isDue(Instant now) {
        return !nextAttempt.isAfter(now);
    }

    int recordAttempt() {
        return ++attempts;
    }

    void rescheduleAt(Instant at) {
        this.nextAttempt = at;
    }
}
