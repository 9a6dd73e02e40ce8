package com.ruach.formation.application.port.out;

import java.time.Instant;

import com.ruach.formation.application.guard.DeduplicationRecord;

/**
 * Secondary (outbound) port: keyed storage behind the deduplication guard.
 * <p>
 * {@link #reserve} must be atomic per key: of two concurrent callers for the
 * same key only one may observe a successful reservation.
 * </p>
 *
 * @param <R> type of the recorded result
 */
public interface DeduplicationStore<R> {

    /**
     * @return the record stored under {@code key}, or null if none
     */
    DeduplicationRecord<R> find(String key);

    /**
     * Atomically stores {@code pending} unless the key is held by a record
     * that still blocks at {@code pending.getRecordedAt()}: an unexpired
     * in-flight record, or a completed record younger than
     * {@code cooldownMs}.
     *
     * @return null if the reservation was stored, otherwise the blocking record
     */
    DeduplicationRecord<R> reserve(String key, DeduplicationRecord<R> pending, long cooldownMs);

    /**
     * Stores a completed record, replacing whatever the key held.
     *
     * @param retentionMs how long the record must be kept at least
     */
    void save(String key, DeduplicationRecord<R> record, long retentionMs);

    /**
     * Removes the in-flight record holding {@code token}. Any other record
     * under the key is left in place.
     */
    void release(String key, String token);

    /**
     * Removes every record that no longer blocks at {@code now}.
     *
     * @param retentionMs age after which a completed record is dropped
     * @return number of records removed
     */
    int evictExpired(Instant now, long retentionMs);

    /**
     * Removes everything.
     */
    void clear();
}
