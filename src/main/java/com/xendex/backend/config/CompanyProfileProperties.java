package com.xendex.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Sender-side company profile fed into every generated draft.
 */
@ConfigurationProperties(prefix = "xendex.company")
public record CompanyProfileProperties(
        @DefaultValue("Xendex") String name,
        @DefaultValue("") String positioning,
        @DefaultValue List<String> services,
        @DefaultValue List<String> proofPoints,
        @DefaultValue("15m") Duration cacheTtl
) {
}
