package com.ruach.formation.application.service;

import java.time.Instant;

/**
 * A user-facing notice that something opened up.
 * <p>
 * The id is derived from user, kind and content, so the same unlock always
 * yields the same id and is delivered once.
 * </p>
 */
public record FormationNotification(
        String notificationId,
        String userId,
        Kind kind,
        String contentId,
        String message,
        Instant createdAt) {

    public enum Kind {
        AXIOM_UNLOCKED,
        PHASE_STARTED
    }

    public static FormationNotification of(String userId, Kind kind, String contentId, String message,
            Instant createdAt) {
        String id = userId + ":" + kind.name().toLowerCase() + ":" + contentId;
        return new FormationNotification(id, userId, kind, contentId, message, createdAt);
    }
}
