package com.ruach.formation.application.guard;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

/**
 * Short-TTL memo for derived read models, backed by Caffeine with a
 * per-entry expiry.
 * <p>
 * A TTL of zero or less means the entry is already expired: nothing is
 * stored and any previous value under the key is dropped.
 * </p>
 *
 * @param <V> cached value type
 */
public class FormationDataCache<V> {

    private final Cache<String, Entry<V>> cache;

    public FormationDataCache(Clock clock, long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new Expiry<String, Entry<V>>() {
                    @Override
                    public long expireAfterCreate(String key, Entry<V> entry, long currentTime) {
                        return entry.ttlNanos;
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry<V> entry, long currentTime,
                            long currentDuration) {
                        return entry.ttlNanos;
                    }

                    @Override
                    public long expireAfterRead(String key, Entry<V> entry, long currentTime,
                            long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    public void set(String key, V value, long ttlMs) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (ttlMs <= 0) {
            cache.invalidate(key);
            return;
        }
        cache.put(key, new Entry<>(value, TimeUnit.MILLISECONDS.toNanos(ttlMs)));
    }

    /**
     * @return the value, or null if missing or expired
     */
    public V get(String key) {
        Entry<V> entry = cache.getIfPresent(key);
        return entry != null ? entry.value : null;
    }

    public boolean has(String key) {
        return cache.getIfPresent(key) != null;
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public void clear() {
        cache.invalidateAll();
    }

    /**
     * Drops expired entries now instead of on the next write.
     */
    public void cleanup() {
        cache.cleanUp();
    }

    private static final class Entry<V> {
        private final V value;
        private final long ttlNanos;

        private Entry(V value, long ttlNanos) {
            this.value = value;
            this.ttlNanos = ttlNanos;
        }
    }
}
