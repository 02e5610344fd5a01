package com.xendex.backend.dto.sequence.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CreateSequenceRequest {
    @NotBlank(message = "Sequence name is required")
    @Size(max = 255, message = "Name must be less than 255 characters")
    private String name;

    @Size(max = 1000, message = "Description must be less than 1000 characters")
    private String description;

    @NotNull
    @Min(value = 1, message = "A sequence needs at least one touch")
    @Max(value = 10, message = "A sequence can have at most 10 touches")
    private Integer touches = 3;

    private List<@NotNull @Min(0) Integer> touchDelays = new ArrayList<>(List.of(3, 5));
}
