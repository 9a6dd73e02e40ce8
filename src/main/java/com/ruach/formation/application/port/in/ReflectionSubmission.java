package com.ruach.formation.application.port.in;

import com.ruach.formation.domain.entity.EventMetadata;
import com.ruach.formation.domain.valueobject.ReflectionType;

/**
 * Inbound command carrying a reflection submitted at a checkpoint.
 *
 * @param userId         submitting user
 * @param checkpointId   checkpoint the reflection answers
 * @param content        reflection text (transcript for voice)
 * @param type           text or voice
 * @param idempotencyKey caller-supplied key; derived from user and
 *                       checkpoint when absent
 * @param metadata       request context, may be null
 */
public record ReflectionSubmission(
        String userId,
        String checkpointId,
        String content,
        ReflectionType type,
        String idempotencyKey,
        EventMetadata metadata) {

    /**
     * @return the caller's key, or {@code submit-<userId>-<checkpointId>}
     */
    public String effectiveIdempotencyKey() {
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            return idempotencyKey;
        }
        return "submit-" + userId + "-" + checkpointId;
    }
}
