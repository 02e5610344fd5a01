package com.xendex.backend.integrations.content;

import com.xendex.backend.models.LeadIntelligence;
import com.xendex.backend.models.TriggerSignal;

import java.util.List;

/**
 * Research about a lead, as handed to strategy selection and content generation.
 */
public record ResearchContext(
        String industry,
        String companySummary,
        List<String> painIndicators,
        List<String> buyingSignals,
        List<TriggerSignal> triggers,
        String linkedinRole,
        String linkedinSeniority,
        List<String> linkedinTopics
) {

    public ResearchContext {
        painIndicators = painIndicators == null ? List.of() : List.copyOf(painIndicators);
        buyingSignals = buyingSignals == null ? List.of() : List.copyOf(buyingSignals);
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        linkedinTopics = linkedinTopics == null ? List.of() : List.copyOf(linkedinTopics);
    }

    public static ResearchContext from(LeadIntelligence intelligence) {
        return new ResearchContext(
                intelligence.getIndustry(),
                intelligence.getCompanySummary(),
                intelligence.getPainIndicators(),
                intelligence.getBuyingSignals(),
                intelligence.getTriggers(),
                intelligence.getLinkedinRole(),
                intelligence.getLinkedinSeniority(),
                intelligence.getLinkedinTopics());
    }

    public boolean hasIndustry() {
        return industry != null && !industry.isBlank();
    }
}
