package com.xendex.backend.dto.sequence.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
public class UpdateSequenceRequest {
    @Size(max = 255, message = "Name must be less than 255 characters")
    private String name;

    @Size(max = 1000, message = "Description must be less than 1000 characters")
    private String description;

    @Min(1)
    @Max(10)
    private Integer touches;

    private List<@NotNull @Min(0) Integer> touchDelays;
}
