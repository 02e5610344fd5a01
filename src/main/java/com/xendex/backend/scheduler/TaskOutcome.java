package com.xendex.backend.scheduler;

import java.time.Duration;

/**
 * What a handler decided. Aborts are normal under at-least-once delivery and are not errors.
 */
public record TaskOutcome(Kind kind, String reason, Duration deferBy) {

    public enum Kind {
        COMPLETED,
        ABORTED,
        DEFERRED
    }

    public static TaskOutcome completed() {
        return new TaskOutcome(Kind.COMPLETED, null, null);
    }

    public static TaskOutcome completed(String note) {
        return new TaskOutcome(Kind.COMPLETED, note, null);
    }

    public static TaskOutcome aborted(String reason) {
        return new TaskOutcome(Kind.ABORTED, reason, null);
    }

    public static TaskOutcome deferred(Duration deferBy, String reason) {
        return new TaskOutcome(Kind.DEFERRED, reason, deferBy);
    }

    public boolean isAborted() {
        return kind == Kind.ABORTED;
    }
}
