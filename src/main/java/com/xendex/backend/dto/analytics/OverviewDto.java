package com.xendex.backend.dto.analytics;

import com.xendex.backend.enums.LeadStatus;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class OverviewDto {
    private Long totalLeads;
    private Map<LeadStatus, Long> leadsByStatus;
    private Long activeSequences;
    private Long pendingApprovals;
    private Integer windowDays;
    private Long sentInWindow;
    private Double openRate;
    private Double replyRate;
    private Double bounceRate;
}
