package com.ruach.formation.application.guard;

/**
 * Outcome of {@link DeduplicationService#tryBegin}: either the caller now
 * owns the key, or a completed result within the cooldown is replayed.
 *
 * @param <R> type of the recorded result
 */
public final class DeduplicationReservation<R> {

    private final String key;
    private final String token;
    private final R previousResult;

    private DeduplicationReservation(String key, String token, R previousResult) {
        this.key = key;
        this.token = token;
        this.previousResult = previousResult;
    }

    static <R> DeduplicationReservation<R> acquired(String key, String token) {
        return new DeduplicationReservation<>(key, token, null);
    }

    static <R> DeduplicationReservation<R> replay(String key, R previousResult) {
        return new DeduplicationReservation<>(key, null, previousResult);
    }

    /**
     * @return true if the caller must do the work and then record or abandon
     */
    public boolean isAcquired() {
        return token != null;
    }

    public String getKey() {
        return key;
    }

    String getToken() {
        return token;
    }

    /**
     * @return the recorded result when not acquired, otherwise null
     */
    public R getPreviousResult() {
        return previousResult;
    }
}
