package com.xendex.backend.dto.draft.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class BulkApproveRequest {
    @NotEmpty(message = "At least one draft is required")
    private List<Long> draftIds;

    private String approvedBy = "user";
}
