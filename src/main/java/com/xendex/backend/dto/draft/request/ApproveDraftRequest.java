package com.xendex.backend.dto.draft.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ApproveDraftRequest {
    @Size(max = 500)
    private String selectedSubject;

    @Size(max = 100)
    private String approvedBy = "user";
}
