package com.xendex.backend.dto.sequence.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class EnrollLeadsRequest {
    @NotEmpty(message = "At least one lead is required")
    private List<Long> leadIds;
}
