package com.xendex.backend.dto.webhook;

import jakarta.validation.constraints.Email;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * A reply seen outside the mail pipeline and logged by hand. Identify the lead by id or email.
 */
@Data
public class ManualReplyRequest {

    private Long leadId;

    @Email
    private String email;

    private String subject;

    private String body;

    private OffsetDateTime repliedAt;
}
