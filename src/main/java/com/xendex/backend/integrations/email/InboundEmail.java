package com.xendex.backend.integrations.email;

import java.time.OffsetDateTime;

/**
 * An email received on the outreach domain.
 *
 * @param from       raw sender, possibly in {@code "Name <address>"} form
 * @param receivedAt null when the provider sent no usable timestamp
 */
public record InboundEmail(String id, String from, String subject, OffsetDateTime receivedAt) {
}
