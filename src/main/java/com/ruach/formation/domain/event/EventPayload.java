package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;

/**
 * Typed body of a formation event.
 * <p>
 * One implementation per {@link EventType}; each carries only the fields
 * its event kind needs. Implementations are immutable.
 * </p>
 */
public interface EventPayload {

    /**
     * @return the discriminant this payload belongs to
     */
    EventType eventType();
}
