package com.xendex.backend.integrations.content;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Templated drafts used when the model is unavailable or returns something unusable.
 * Touch 1 follows the strategy angle, touch 2 is a short follow-up, later touches close the loop.
 */
@Component
public class FallbackDraftTemplates {

    public GenerationResult build(TouchContext context, CompanyProfile profile, String reason) {
        if (context.touchNumber() == 2) {
            return followUp(context, profile, reason);
        }
        if (context.touchNumber() > 2) {
            return breakup(context, profile, reason);
        }
        return opener(context, profile, reason);
    }

    private GenerationResult opener(TouchContext context, CompanyProfile profile, String reason) {
        String company = context.companyOrFallback();
        String hook = context.strategy().hook();

        String opening = switch (context.strategy().angle()) {
            case TRIGGER_LED -> hook != null
                    ? "Saw the news about " + hook + " and figured outbound is on your mind."
                    : "Noticed some changes at " + company + " recently.";
            case PROBLEM_HYPOTHESIS -> hook != null
                    ? "Teams dealing with " + hook + " usually feel it first in pipeline."
                    : "Most teams like " + company + " hit the same pipeline ceiling.";
            case CASE_STUDY -> "We recently helped a team in "
                    + (context.research().hasIndustry() ? context.research().industry() : "your space")
                    + " rebuild their outbound motion.";
            case VALUE_INSIGHT -> "One pattern we keep seeing with teams like " + company + ".";
        };

        String body = "Hi " + context.firstName() + ",\n\n"
                + opening + " " + nullToEmpty(profile.positioning()) + "\n\n"
                + context.strategy().cta().getPrompt() + ".\n\n"
                + "Best,\n" + profile.name();

        return GenerationResult.fallback(List.of(
                "Quick question about " + company,
                "Idea for " + company,
                context.firstName() + ", worth a look?"
        ), body, reason);
    }

    private GenerationResult followUp(TouchContext context, CompanyProfile profile, String reason) {
        String body = "Hi " + context.firstName() + ",\n\n"
                + "Following up on my last note in case it got buried. "
                + firstOr(profile.proofPoints(), "Happy to share what has worked for similar teams.") + "\n\n"
                + context.strategy().cta().getPrompt() + ".\n\n"
                + "Best,\n" + profile.name();
        return GenerationResult.fallback(List.of(
                "Re: " + context.companyOrFallback(),
                "Following up",
                "Any thoughts?"
        ), body, reason);
    }

    private GenerationResult breakup(TouchContext context, CompanyProfile profile, String reason) {
        String body = "Hi " + context.firstName() + ",\n\n"
                + "I have not heard back, so I will assume the timing is off and stop reaching out. "
                + "If things change, just reply to this email.\n\n"
                + "Best,\n" + profile.name();
        return GenerationResult.fallback(List.of(
                "Closing the loop",
                "Should I stop reaching out?",
                "Last note from me"
        ), body, reason);
    }

    private static String firstOr(List<String> values, String fallback) {
        return values.isEmpty() ? fallback : values.get(0);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
