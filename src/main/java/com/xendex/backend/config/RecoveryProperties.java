package com.xendex.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "xendex.recovery")
public record RecoveryProperties(
        @DefaultValue("10m") Duration researchTimeout
) {
}
