package com.xendex.backend.dto.analytics;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class FunnelDto {
    private Long totalLeads;
    private List<FunnelStageDto> stages;
    private Double contactedRate;
    private Double replyRate;
    private Double conversionRate;
}
