package com.xendex.backend.integrations.content;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompanyProfileCacheTest {

    private MutableClock clock;
    private AtomicInteger loads;
    private CompanyProfileCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        loads = new AtomicInteger();
        cache = new CompanyProfileCache(() -> new CompanyProfile("Xendex v" + loads.incrementAndGet(),
                "Outbound for B2B teams", List.of("Outbound"), List.of()), Duration.ofMinutes(15), clock);
    }

    @Test
    void get_WithinTtl_ShouldLoadOnce() {
        // when
        cache.get();
        clock.advance(Duration.ofMinutes(14));
        CompanyProfile profile = cache.get();

        // then
        assertThat(loads.get()).isEqualTo(1);
        assertThat(profile.name()).isEqualTo("Xendex v1");
    }

    @Test
    void get_AtTtl_ShouldReload() {
        // when
        cache.get();
        clock.advance(Duration.ofMinutes(15));
        CompanyProfile profile = cache.get();

        // then
        assertThat(loads.get()).isEqualTo(2);
        assertThat(profile.name()).isEqualTo("Xendex v2");
    }

    @Test
    void invalidate_ShouldForceReload() {
        // when
        cache.get();
        cache.invalidate();
        cache.get();

        // then
        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void constructor_NonPositiveTtl_ShouldThrow() {
        assertThatThrownBy(() -> new CompanyProfileCache(() -> null, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
