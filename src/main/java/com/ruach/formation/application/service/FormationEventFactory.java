package com.ruach.formation.application.service;

import java.time.Clock;
import java.util.UUID;

import com.ruach.formation.domain.entity.EventMetadata;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.event.EventPayload;
import com.ruach.formation.domain.valueobject.EventType;

/**
 * Produces well-formed events: fresh UUID, current time from the injected
 * clock, typed payload.
 * <p>
 * Structural completeness only. Business rules are checked by the
 * submission guard before anything reaches this factory.
 * </p>
 */
public class FormationEventFactory {

    private final Clock clock;

    public FormationEventFactory(Clock clock) {
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        this.clock = clock;
    }

    public FormationEvent createEvent(String userId, EventPayload payload) {
        return createEvent(userId, payload, EventMetadata.empty());
    }

    public FormationEvent createEvent(String userId, EventPayload payload, EventMetadata metadata) {
        return new FormationEvent(UUID.randomUUID().toString(), userId, clock.instant(), payload, metadata);
    }

    /**
     * Variant taking the discriminant explicitly, for callers that resolve
     * the type and payload separately.
     *
     * @throws IllegalArgumentException if the payload belongs to another type
     */
    public FormationEvent createEvent(String userId, EventType eventType, EventPayload payload,
            EventMetadata metadata) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (payload.eventType() != eventType) {
            throw new IllegalArgumentException(
                    "Payload " + payload.getClass().getSimpleName() + " does not match eventType " + eventType);
        }
        return createEvent(userId, payload, metadata);
    }
}
