package com.xendex.backend.services.sequence;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * An inbound reply, whatever channel it arrived through.
 *
 * @param messageId  provider id of the reply, used to ignore repeats; may be null for manual logs
 * @param occurredAt when the reply happened; null means now
 */
public record ReplySignal(Long leadId, String messageId, String subject, String body,
                          OffsetDateTime occurredAt, String source) {

    public ReplySignal {
        Objects.requireNonNull(leadId, "leadId");
    }

    public static ReplySignal manual(Long leadId, String body, String source) {
        return new ReplySignal(leadId, null, null, body, null, source);
    }
}
