package com.xendex.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * The only time source for task scheduling, reply cut-offs and stuck-state sweeps.
 * Inject the {@link Clock}; never call {@code OffsetDateTime.now()} without it.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
