package com.ruach.formation.application.guard;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ruach.formation.support.MutableClock;

@DisplayName("FormationDataCache")
class FormationDataCacheTest {

    private MutableClock clock;
    private FormationDataCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        cache = new FormationDataCache<>(clock, 100);
    }

    @Test
    @DisplayName("returns a value until its TTL passes")
    void expiresAfterTtl() {
        cache.set("axioms:user-1:3", "statuses", 30_000);

        clock.advanceMillis(29_999);
        assertThat(cache.get("axioms:user-1:3")).isEqualTo("statuses");

        clock.advanceMillis(1);
        assertThat(cache.get("axioms:user-1:3")).isNull();
        assertThat(cache.has("axioms:user-1:3")).isFalse();
    }

    @Test
    @DisplayName("a negative TTL is already expired")
    void negativeTtl() {
        cache.set("key", "value", -1_000);

        assertThat(cache.get("key")).isNull();
        assertThat(cache.has("key")).isFalse();
    }

    @Test
    @DisplayName("a zero TTL drops any previous value")
    void zeroTtlDropsPrevious() {
        cache.set("key", "old", 10_000);

        cache.set("key", "new", 0);

        assertThat(cache.get("key")).isNull();
    }

    @Test
    @DisplayName("each entry keeps its own TTL")
    void perEntryTtl() {
        cache.set("short", "a", 1_000);
        cache.set("long", "b", 10_000);

        clock.advanceMillis(5_000);

        assertThat(cache.get("short")).isNull();
        assertThat(cache.get("long")).isEqualTo("b");
    }

    @Test
    @DisplayName("invalidate and clear remove entries")
    void invalidateAndClear() {
        cache.set("a", "1", 10_000);
        cache.set("b", "2", 10_000);

        cache.invalidate("a");
        assertThat(cache.has("a")).isFalse();
        assertThat(cache.has("b")).isTrue();

        cache.clear();
        cache.cleanup();
        assertThat(cache.has("b")).isFalse();
    }
}
