package com.ruach.formation.application.guard;

import java.time.Instant;

/**
 * Raised when a submission arrives for an idempotency key whose first
 * request is still being processed.
 * <p>
 * A key whose first request has already completed is not an error: the
 * recorded result is replayed instead.
 * </p>
 */
public class DuplicateSubmissionException extends RuntimeException {

    private final String operationId;
    private final Instant recordedAt;
    private final long cooldownMs;

    public DuplicateSubmissionException(String operationId, Instant recordedAt, long cooldownMs) {
        super(String.format("Duplicate submission for operation %s (first seen at %s, cooldown %dms)",
                operationId, recordedAt, cooldownMs));
        this.operationId = operationId;
        this.recordedAt = recordedAt;
        this.cooldownMs = cooldownMs;
    }

    public String getOperationId() {
        return operationId;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public long getCooldownMs() {
        return cooldownMs;
    }
}
