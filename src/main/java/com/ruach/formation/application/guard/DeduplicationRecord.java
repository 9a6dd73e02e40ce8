package com.ruach.formation.application.guard;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * What the deduplication store keeps per idempotency key: either an
 * in-flight reservation or a completed result.
 *
 * @param <R> type of the recorded result
 */
public final class DeduplicationRecord<R> {

    public enum Status {
        IN_FLIGHT,
        DONE
    }

    private final Status status;
    private final String token;
    private final R result;
    private final Instant recordedAt;
    private final Instant expiresAt;

    public DeduplicationRecord(Status status, String token, R result, Instant recordedAt, Instant expiresAt) {
        if (status == null || recordedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("status, recordedAt and expiresAt cannot be null");
        }
        if (status == Status.IN_FLIGHT && token == null) {
            throw new IllegalArgumentException("in-flight records need a token");
        }
        this.status = status;
        this.token = token;
        this.result = result;
        this.recordedAt = recordedAt;
        this.expiresAt = expiresAt;
    }

    public static <R> DeduplicationRecord<R> inFlight(String token, Instant now, long timeoutMs) {
        return new DeduplicationRecord<>(Status.IN_FLIGHT, token, null, now, now.plusMillis(timeoutMs));
    }

    public static <R> DeduplicationRecord<R> done(R result, Instant now, long retentionMs) {
        return new DeduplicationRecord<>(Status.DONE, null, result, now, now.plusMillis(retentionMs));
    }

    /**
     * Checks whether this record still turns a new request away.
     *
     * @param now        time of the new request
     * @param cooldownMs window during which a completed result is replayed;
     *                   0 or less disables replay
     */
    public boolean blocks(Instant now, long cooldownMs) {
        if (status == Status.IN_FLIGHT) {
            return now.isBefore(expiresAt);
        }
        return cooldownMs > 0 && Duration.between(recordedAt, now).toMillis() < cooldownMs;
    }

    /**
     * @return true once the record may be dropped from the store
     */
    public boolean isExpired(Instant now, long retentionMs) {
        if (status == Status.IN_FLIGHT) {
            return !now.isBefore(expiresAt);
        }
        return Duration.between(recordedAt, now).toMillis() >= retentionMs;
    }

    public boolean isInFlight() {
        return status == Status.IN_FLIGHT;
    }

    public Status getStatus() {
        return status;
    }

    public String getToken() {
        return token;
    }

    public R getResult() {
        return result;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        DeduplicationRecord<?> that = (DeduplicationRecord<?>) o;
        return status == that.status && Objects.equals(token, that.token)
                && Objects.equals(result, that.result) && recordedAt.equals(that.recordedAt)
                && expiresAt.equals(that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, token, result, recordedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "DeduplicationRecord{status=" + status + ", recordedAt=" + recordedAt + "}";
    }
}
