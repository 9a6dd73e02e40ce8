package com.ruach.formation.application.port.out;

import java.util.List;

import com.ruach.formation.domain.entity.FormationEvent;

/**
 * Secondary (outbound) port: append-only formation event log.
 * <p>
 * The log is the source of truth for every user's journey. Implementations
 * must be idempotent: appending an event whose id is already stored is a
 * no-op, so a retried append after a timeout never double-applies.
 * </p>
 */
public interface FormationEventStore {

    /**
     * Appends events for one or more users. Events already stored (same id)
     * are silently ignored.
     *
     * @param events events to append, in creation order
     */
    void append(List<FormationEvent> events);

    /**
     * Returns the complete event history of a user.
     *
     * @param userId user identifier
     * @return events ordered by timestamp ascending, empty if none
     */
    List<FormationEvent> findByUserId(String userId);
}
