package com.xendex.backend.dto.draft.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class UpdateDraftRequest {
    private List<@Size(max = 500) String> subjectOptions;

    @Size(max = 500)
    private String selectedSubject;

    private String body;
}
