package com.ruach.formation.adapters.out.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ruach.formation.application.port.out.FormationEventStore;
import com.ruach.formation.domain.entity.FormationEvent;

/**
 * Process-local event log for development and tests. Same contract as the
 * PostgreSQL store: idempotent on id, history ordered by timestamp.
 */
public class InMemoryFormationEventStore implements FormationEventStore {

    private final Map<String, FormationEvent> events = new LinkedHashMap<>();

    @Override
    public synchronized void append(List<FormationEvent> newEvents) {
        for (FormationEvent event : newEvents) {
            events.putIfAbsent(event.getId(), event);
        }
    }

    @Override
    public synchronized List<FormationEvent> findByUserId(String userId) {
        List<FormationEvent> result = new ArrayList<>();
        for (FormationEvent event : events.values()) {
            if (event.getUserId().equals(userId)) {
                result.add(event);
            }
        }
        result.sort(FormationEvent.REPLAY_ORDER);
        return result;
    }

    public synchronized int size() {
        return events.size();
    }
}
