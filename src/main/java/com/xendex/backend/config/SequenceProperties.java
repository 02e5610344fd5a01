package com.xendex.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Timing rules for sequence progression.
 *
 * @param confirmationGrace wait between touch 1 being sent and the lead becoming "contacted"
 * @param delayUnit         unit applied to the integer touch delays of a sequence (MINUTES for test runs)
 * @param defaultTouchDelay delay used when a sequence lists fewer delays than it has touches
 * @param pausedRecheck     how long a follow-up waits before re-checking a paused sequence
 */
@ConfigurationProperties(prefix = "xendex.sequence")
public record SequenceProperties(
        @DefaultValue("60s") Duration confirmationGrace,
        @DefaultValue("DAYS") ChronoUnit delayUnit,
        @DefaultValue("3") int defaultTouchDelay,
        @DefaultValue("1h") Duration pausedRecheck,
        @DefaultValue DefaultSequence defaultSequence
) {

    public Duration touchDelay(int amount) {
        return Duration.of(Math.max(0, amount), delayUnit);
    }

    public record DefaultSequence(
            @DefaultValue("DEFAULT-FOLLOWUP") String externalId,
            @DefaultValue("Default Follow-up") String name,
            @DefaultValue("3") int touches,
            @DefaultValue({"3", "5"}) List<Integer> touchDelays
    ) {
    }
}
