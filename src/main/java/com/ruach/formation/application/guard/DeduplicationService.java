package com.ruach.formation.application.guard;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.logging.Logger;

import com.ruach.formation.application.port.out.DeduplicationStore;

/**
 * At-most-one effective processing per idempotency key within a cooldown
 * window.
 * <p>
 * A repeated request inside the window becomes a replay of the recorded
 * result instead of a second state mutation. The store decides reservation
 * atomically, so of two concurrent callers for one key only the first
 * proceeds.
 * </p>
 *
 * @param <R> type of the recorded result
 */
public class DeduplicationService<R> {

    private static final Logger log = Logger.getLogger(DeduplicationService.class.getName());

    private final DeduplicationStore<R> store;
    private final Clock clock;
    private final long retentionMs;
    private final long inFlightTimeoutMs;

    /**
     * @param retentionMs       how long completed results are kept; also the
     *                          window used by {@link #cleanup()}
     * @param inFlightTimeoutMs after this an abandoned reservation no longer
     *                          blocks the key
     */
    public DeduplicationService(DeduplicationStore<R> store, Clock clock, long retentionMs,
            long inFlightTimeoutMs) {
        if (store == null)
            throw new IllegalArgumentException("store cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        if (retentionMs < 0 || inFlightTimeoutMs <= 0)
            throw new IllegalArgumentException("retentionMs must be >= 0 and inFlightTimeoutMs > 0");

        this.store = store;
        this.clock = clock;
        this.retentionMs = retentionMs;
        this.inFlightTimeoutMs = inFlightTimeoutMs;
    }

    /**
     * Checks whether {@code key} has already been processed within
     * {@code cooldownMs}. A request still in flight counts as processed.
     *
     * @param cooldownMs 0 (or less) never reports a duplicate
     */
    public boolean checkDuplicate(String key, long cooldownMs) {
        if (cooldownMs <= 0) {
            return false;
        }
        DeduplicationRecord<R> existing = store.find(key);
        return existing != null && existing.blocks(clock.instant(), cooldownMs);
    }

    /**
     * Records the result of a completed operation, stamped with the current
     * time. Replaces any in-flight reservation for the key.
     */
    public void recordSuccess(String key, R result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        store.save(key, DeduplicationRecord.done(result, clock.instant(), retentionMs), retentionMs);
        log.fine(String.format("action=dedup_recorded key=%s", key));
    }

    /**
     * @return the recorded result for {@code key}, or null if none was
     *         recorded or the request is still in flight
     */
    public R getPreviousResult(String key) {
        DeduplicationRecord<R> existing = store.find(key);
        if (existing == null || existing.isInFlight()) {
            return null;
        }
        return existing.getResult();
    }

    /**
     * Evicts entries whose retention has fully elapsed and reservations
     * that timed out.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        int removed = store.evictExpired(clock.instant(), retentionMs);
        if (removed > 0) {
            log.fine(String.format("action=dedup_cleanup removed=%d", removed));
        }
        return removed;
    }

    /**
     * Atomically claims {@code key} for processing.
     *
     * @param cooldownMs window in which a completed result is replayed;
     *                   0 (or less) always acquires
     * @return an acquired reservation, or a replay of the recorded result
     * @throws DuplicateSubmissionException if another request for the key
     *                                      is still in flight
     */
    public DeduplicationReservation<R> tryBegin(String key, long cooldownMs) {
        String token = UUID.randomUUID().toString();
        if (cooldownMs <= 0) {
            return DeduplicationReservation.acquired(key, token);
        }

        Instant now = clock.instant();
        DeduplicationRecord<R> blocking = store.reserve(key,
                DeduplicationRecord.inFlight(token, now, inFlightTimeoutMs), cooldownMs);
        if (blocking == null) {
            return DeduplicationReservation.acquired(key, token);
        }
        if (blocking.isInFlight()) {
            log.warning(String.format("action=dedup_in_flight key=%s recordedAt=%s", key, blocking.getRecordedAt()));
            throw new DuplicateSubmissionException(key, blocking.getRecordedAt(), cooldownMs);
        }
        log.info(String.format("action=dedup_replay key=%s recordedAt=%s", key, blocking.getRecordedAt()));
        return DeduplicationReservation.replay(key, blocking.getResult());
    }

    /**
     * Completes an acquired reservation with its result.
     */
    public void complete(DeduplicationReservation<R> reservation, R result) {
        if (!reservation.isAcquired()) {
            throw new IllegalStateException("Reservation for " + reservation.getKey() + " was not acquired");
        }
        recordSuccess(reservation.getKey(), result);
    }

    /**
     * Releases an acquired reservation after a failure so the caller may
     * retry with the same key.
     */
    public void abandon(DeduplicationReservation<R> reservation) {
        if (reservation.isAcquired()) {
            store.release(reservation.getKey(), reservation.getToken());
        }
    }

    public void clear() {
        store.clear();
    }
}
