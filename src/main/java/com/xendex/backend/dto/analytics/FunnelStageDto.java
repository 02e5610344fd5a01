package com.xendex.backend.dto.analytics;

import com.xendex.backend.enums.LeadStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FunnelStageDto {
    private LeadStatus status;
    private String label;
    private Long count;
    private Double percentage;
}
