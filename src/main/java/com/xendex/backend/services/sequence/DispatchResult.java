package com.xendex.backend.services.sequence;

import java.time.OffsetDateTime;

/**
 * Result of trying to send an approved draft.
 *
 * @param retryable for FAILED only: whether trying again later could succeed
 */
public record DispatchResult(Status status, OffsetDateTime sentAt, String messageId, String error, boolean retryable) {

    public enum Status {
        SENT,
        ALREADY_SENT,
        FAILED
    }

    public static DispatchResult sent(OffsetDateTime sentAt, String messageId) {
        return new DispatchResult(Status.SENT, sentAt, messageId, null, false);
    }

    public static DispatchResult alreadySent() {
        return new DispatchResult(Status.ALREADY_SENT, null, null, null, false);
    }

    public static DispatchResult transientFailure(String error) {
        return new DispatchResult(Status.FAILED, null, null, error, true);
    }

    public static DispatchResult permanentFailure(String error) {
        return new DispatchResult(Status.FAILED, null, null, error, false);
    }

    public boolean isSent() {
        return status == Status.SENT;
    }
}
