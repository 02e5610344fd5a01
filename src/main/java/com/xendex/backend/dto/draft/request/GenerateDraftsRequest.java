package com.xendex.backend.dto.draft.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class GenerateDraftsRequest {
    @NotEmpty(message = "At least one lead is required")
    private List<Long> leadIds;

    /** Defaults to the system follow-up sequence. */
    private Long sequenceId;
}
