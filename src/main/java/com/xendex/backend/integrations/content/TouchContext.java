package com.xendex.backend.integrations.content;

import com.xendex.backend.models.Lead;

import java.util.Objects;

/**
 * Everything content generation needs for one touch of one lead.
 */
public record TouchContext(
        Long leadId,
        String firstName,
        String companyName,
        String persona,
        ResearchContext research,
        Strategy strategy,
        int touchNumber
) {

    public TouchContext {
        Objects.requireNonNull(leadId, "leadId");
        Objects.requireNonNull(research, "research");
        Objects.requireNonNull(strategy, "strategy");
        if (touchNumber < 1) {
            throw new IllegalArgumentException("touchNumber must be >= 1, got: " + touchNumber);
        }
    }

    public static TouchContext of(Lead lead, ResearchContext research, Strategy strategy, int touchNumber) {
        return new TouchContext(lead.getId(), lead.getDisplayName(), lead.getCompanyName(),
                lead.getPersona(), research, strategy, touchNumber);
    }

    public String companyOrFallback() {
        return companyName == null || companyName.isBlank() ? "your team" : companyName;
    }
}
