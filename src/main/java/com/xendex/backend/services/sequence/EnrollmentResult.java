package com.xendex.backend.services.sequence;

import java.util.List;

public record EnrollmentResult(int added, int skipped, List<SkippedLead> skippedLeads) {

    public record SkippedLead(Long leadId, String reason) {
    }
}
