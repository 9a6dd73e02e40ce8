package com.ruach.formation.domain.entity;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

import com.ruach.formation.domain.event.EventPayload;
import com.ruach.formation.domain.valueobject.EventType;

/**
 * Immutable, append-only record of something that happened in a user's
 * formation journey.
 * <p>
 * Events are never mutated or deleted. Corrections are new compensating
 * events. The discriminant is taken from the typed payload so the two can
 * never disagree.
 * </p>
 *
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>id is non-null, non-blank (a UUID string)</li>
 * <li>userId is non-null, non-blank</li>
 * <li>timestamp and payload are non-null</li>
 * <li>metadata is never null ({@link EventMetadata#empty()} if not provided)</li>
 * </ul>
 */
public final class FormationEvent {

    /**
     * Replay order: timestamp ascending, then event type declaration order,
     * then id. Total, so equal-timestamp events still replay identically.
     */
    public static final Comparator<FormationEvent> REPLAY_ORDER = Comparator
            .comparing(FormationEvent::getTimestamp)
            .thenComparing(FormationEvent::getEventType)
            .thenComparing(FormationEvent::getId);

    private final String id;
    private final String userId;
    private final Instant timestamp;
    private final EventPayload payload;
    private final EventMetadata metadata;

    public FormationEvent(String id, String userId, Instant timestamp,
            EventPayload payload, EventMetadata metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }

        this.id = id;
        this.userId = userId;
        this.timestamp = timestamp;
        this.payload = payload;
        this.metadata = metadata != null ? metadata : EventMetadata.empty();
    }

    /**
     * Returns the payload cast to the expected variant.
     *
     * @throws IllegalStateException if the payload is of another variant
     */
    public <T extends EventPayload> T payloadAs(Class<T> payloadType) {
        if (!payloadType.isInstance(payload)) {
            throw new IllegalStateException("Event " + id + " of type " + getEventType()
                    + " does not carry a " + payloadType.getSimpleName());
        }
        return payloadType.cast(payload);
    }

    // ─────────────────── Getters ───────────────────

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public EventType getEventType() {
        return payload.eventType();
    }

    public EventPayload getPayload() {
        return payload;
    }

    public EventMetadata getMetadata() {
        return metadata;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        FormationEvent that = (FormationEvent) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "FormationEvent{id='" + id
                + "', userId='" + userId
                + "', eventType=" + getEventType()
                + ", timestamp=" + timestamp + "}";
    }
}
