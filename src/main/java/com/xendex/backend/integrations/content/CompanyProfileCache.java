package com.xendex.backend.integrations.content;

import com.xendex.backend.config.CompanyProfileProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Holds the sender's company profile for the life of the process, reloading it once the TTL
 * has elapsed. The entry is checked for expiry on every read.
 */
@Component
@Slf4j
public class CompanyProfileCache {

    private final Supplier<CompanyProfile> loader;
    private final Duration ttl;
    private final Clock clock;

    private CompanyProfile cached;
    private Instant loadedAt;

    @Autowired
    public CompanyProfileCache(CompanyProfileProperties properties, Clock clock) {
        this(() -> new CompanyProfile(properties.name(), properties.positioning(),
                properties.services(), properties.proofPoints()), properties.cacheTtl(), clock);
    }

    public CompanyProfileCache(Supplier<CompanyProfile> loader, Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        this.loader = loader;
        this.ttl = ttl;
        this.clock = clock;
    }

    public synchronized CompanyProfile get() {
        Instant now = clock.instant();
        if (cached == null || isExpired(now)) {
            cached = loader.get();
            loadedAt = now;
            log.debug("Loaded company profile '{}'", cached.name());
        }
        return cached;
    }

    public synchronized void invalidate() {
        cached = null;
        loadedAt = null;
    }

    private boolean isExpired(Instant now) {
        return !now.isBefore(loadedAt.plus(ttl));
    }
}
