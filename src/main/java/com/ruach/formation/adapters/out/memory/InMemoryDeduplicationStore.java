package com.ruach.formation.adapters.out.memory;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.ruach.formation.application.guard.DeduplicationRecord;
import com.ruach.formation.application.port.out.DeduplicationStore;

/**
 * Per-process deduplication store. Reservation runs inside
 * {@link ConcurrentHashMap#compute}, which is atomic per key.
 *
 * @param <R> type of the recorded result
 */
public class InMemoryDeduplicationStore<R> implements DeduplicationStore<R> {

    private final ConcurrentMap<String, DeduplicationRecord<R>> records = new ConcurrentHashMap<>();

    @Override
    public DeduplicationRecord<R> find(String key) {
        return records.get(key);
    }

    @Override
    public DeduplicationRecord<R> reserve(String key, DeduplicationRecord<R> pending, long cooldownMs) {
        AtomicReference<DeduplicationRecord<R>> blocking = new AtomicReference<>();
        records.compute(key, (k, existing) -> {
            if (existing != null && existing.blocks(pending.getRecordedAt(), cooldownMs)) {
                blocking.set(existing);
                return existing;
            }
            return pending;
        });
        return blocking.get();
    }

    @Override
    public void save(String key, DeduplicationRecord<R> record, long retentionMs) {
        records.put(key, record);
    }

    @Override
    public void release(String key, String token) {
        records.computeIfPresent(key, (k, existing) ->
                existing.isInFlight() && token.equals(existing.getToken()) ? null : existing);
    }

    @Override
    public int evictExpired(Instant now, long retentionMs) {
        AtomicInteger removed = new AtomicInteger();
        for (String key : records.keySet()) {
            records.computeIfPresent(key, (k, existing) -> {
                if (existing.isExpired(now, retentionMs)) {
                    removed.incrementAndGet();
                    return null;
                }
                return existing;
            });
        }
        return removed.get();
    }

    @Override
    public void clear() {
        records.clear();
    }

    public int size() {
        return records.size();
    }
}
