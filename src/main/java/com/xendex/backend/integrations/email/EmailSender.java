package com.xendex.backend.integrations.email;

/**
 * Outbound email transport. Each call is attempted at most once; callers decide about retries.
 */
public interface EmailSender {

    SendResult send(String toEmail, String subject, String body);
}
