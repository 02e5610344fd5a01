package com.xendex.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings for the persistent delayed-task scheduler.
 *
 * @param leaseTimeout a RUNNING task older than this is assumed orphaned and is redelivered
 */
@ConfigurationProperties(prefix = "xendex.tasks")
public record TaskSchedulerProperties(
        @DefaultValue("50") int batchSize,
        @DefaultValue("15m") Duration leaseTimeout,
        @DefaultValue("5") int maxAttempts,
        @DefaultValue("30s") Duration backoffBase,
        @DefaultValue("1h") Duration backoffMax,
        @DefaultValue("30d") Duration retention,
        @DefaultValue Worker worker
) {

    public record Worker(
            @DefaultValue("5") int corePoolSize,
            @DefaultValue("20") int maxPoolSize,
            @DefaultValue("100") int queueCapacity
    ) {
    }
}
