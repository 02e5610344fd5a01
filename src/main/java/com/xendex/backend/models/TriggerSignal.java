package com.xendex.backend.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A buying trigger found during research (funding, hiring, launch, ...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerSignal {
    private String type;
    private String description;
    private double confidence;
    private Integer recencyDays;
}
