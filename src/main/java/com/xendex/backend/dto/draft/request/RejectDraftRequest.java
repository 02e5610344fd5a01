package com.xendex.backend.dto.draft.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RejectDraftRequest {
    @Size(max = 500)
    private String reason;
}
