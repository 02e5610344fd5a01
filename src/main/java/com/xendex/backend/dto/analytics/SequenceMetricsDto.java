package com.xendex.backend.dto.analytics;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SequenceMetricsDto {
    private Long sequenceId;
    private String sequenceName;
    private Long totalLeads;
    private Long activeMembers;
    private Long completedMembers;
    private Long sent;
    private Long delivered;
    private Long opened;
    private Long clicked;
    private Long replied;
    private Long bounced;
    private Long complaints;

    // percentages, 0-100
    private Double deliveryRate;
    private Double openRate;
    private Double replyRate;
}
