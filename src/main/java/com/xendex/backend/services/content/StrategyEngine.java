package com.xendex.backend.services.content;

import com.xendex.backend.enums.CallToAction;
import com.xendex.backend.enums.StrategyAngle;
import com.xendex.backend.integrations.content.ResearchContext;
import com.xendex.backend.integrations.content.Strategy;
import com.xendex.backend.models.TriggerSignal;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the angle, call to action and tone for a lead from its research.
 */
@Service
public class StrategyEngine {

    static final double STRONG_TRIGGER_CONFIDENCE = 0.7;
    static final int RECENT_TRIGGER_DAYS = 60;
    private static final String DEFAULT_TONE = "professional";

    public Strategy select(ResearchContext research) {
        Optional<TriggerSignal> trigger = strongestRecentTrigger(research);
        if (trigger.isPresent()) {
            return new Strategy(StrategyAngle.TRIGGER_LED, CallToAction.REPLY_YES_NO, DEFAULT_TONE,
                    trigger.get().getDescription());
        }

        if (!research.linkedinTopics().isEmpty() || research.painIndicators().size() >= 2) {
            String hook = !research.painIndicators().isEmpty()
                    ? research.painIndicators().get(0)
                    : research.linkedinTopics().get(0);
            return new Strategy(StrategyAngle.PROBLEM_HYPOTHESIS, CallToAction.REPLY, DEFAULT_TONE, hook);
        }

        if (research.hasIndustry()) {
            return new Strategy(StrategyAngle.CASE_STUDY, CallToAction.RESOURCE, DEFAULT_TONE, research.industry());
        }

        return new Strategy(StrategyAngle.VALUE_INSIGHT, CallToAction.REPLY, DEFAULT_TONE, null);
    }

    /**
     * Same research, but with the caller's angle forced (used when a human regenerates a draft).
     */
    public Strategy select(ResearchContext research, StrategyAngle override) {
        Strategy chosen = select(research);
        if (override == null || override == chosen.angle()) {
            return chosen;
        }
        CallToAction cta = switch (override) {
            case TRIGGER_LED -> CallToAction.REPLY_YES_NO;
            case CASE_STUDY -> CallToAction.RESOURCE;
            default -> CallToAction.REPLY;
        };
        return new Strategy(override, cta, chosen.tone(), chosen.hook());
    }

    private Optional<TriggerSignal> strongestRecentTrigger(ResearchContext research) {
        return research.triggers().stream()
                .filter(t -> t.getConfidence() > STRONG_TRIGGER_CONFIDENCE)
                .filter(t -> t.getRecencyDays() != null && t.getRecencyDays() < RECENT_TRIGGER_DAYS)
                .max(Comparator.comparingDouble(TriggerSignal::getConfidence));
    }
}
