package com.example.reportsync.dto;

import com.example.reportsync.model.SyncErrorCode;

/**
 * Success/failure of an orchestrator action that has no payload.
 */
public record ActionResult(boolean success, SyncErrorCode errorCode, String errorMessage) {

    private static final ActionResult OK = new ActionResult(true, null, null);

    public static ActionResult ok() {
        return OK;
    }

    public static ActionResult fail(SyncErrorCode code, String message) {
        return new ActionResult(false, code, message);
    }
}
