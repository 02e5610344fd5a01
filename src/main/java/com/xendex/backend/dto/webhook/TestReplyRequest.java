package com.xendex.backend.dto.webhook;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class TestReplyRequest {

    @NotNull(message = "leadId is required")
    private Long leadId;

    private String body;
}
