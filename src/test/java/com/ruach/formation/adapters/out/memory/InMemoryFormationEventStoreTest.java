package com.ruach.formation.adapters.out.memory;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.event.CovenantEntered;
import com.ruach.formation.domain.valueobject.CovenantType;
import com.ruach.formation.support.Events;

@DisplayName("InMemoryFormationEventStore")
class InMemoryFormationEventStoreTest {

    private final InMemoryFormationEventStore store = new InMemoryFormationEventStore();

    @Test
    @DisplayName("returns a user's events in replay order")
    void replayOrder() {
        FormationEvent later = Events.reached(Events.T0.plusSeconds(60), 1);
        FormationEvent earlier = Events.covenant(Events.T0);

        store.append(List.of(later, earlier));

        assertThat(store.findByUserId(Events.USER)).containsExactly(earlier, later);
    }

    @Test
    @DisplayName("ignores an event id it already holds")
    void idempotentAppend() {
        FormationEvent event = Events.covenant(Events.T0);

        store.append(List.of(event));
        store.append(List.of(event));

        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("keeps users apart")
    void perUser() {
        store.append(List.of(Events.covenant(Events.T0), new FormationEvent(UUID.randomUUID().toString(),
                "user-2", Events.T0, new CovenantEntered(CovenantType.FORMATION_JOURNEY, true), null)));

        assertThat(store.findByUserId("user-2")).hasSize(1);
        assertThat(store.findByUserId("user-3")).isEmpty();
    }
}
