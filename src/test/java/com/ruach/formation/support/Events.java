package com.ruach.formation.support;

import java.time.Instant;
import java.util.UUID;

import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.event.CheckpointCompleted;
import com.ruach.formation.domain.event.CheckpointReached;
import com.ruach.formation.domain.event.CovenantEntered;
import com.ruach.formation.domain.event.EventPayload;
import com.ruach.formation.domain.event.PhaseStarted;
import com.ruach.formation.domain.event.ReflectionSubmitted;
import com.ruach.formation.domain.valueobject.CovenantType;
import com.ruach.formation.domain.valueobject.FormationPhase;
import com.ruach.formation.domain.valueobject.ReflectionType;

/**
 * Builders for hand-written event histories.
 */
public final class Events {

    public static final String USER = "user-1";
    public static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private Events() {
    }

    public static FormationEvent at(Instant timestamp, EventPayload payload) {
        return new FormationEvent(UUID.randomUUID().toString(), USER, timestamp, payload, null);
    }

    public static FormationEvent covenant(Instant timestamp) {
        return at(timestamp, new CovenantEntered(CovenantType.FORMATION_JOURNEY, true));
    }

    public static FormationEvent phaseStarted(Instant timestamp, FormationPhase phase, FormationPhase previous) {
        return at(timestamp, new PhaseStarted(phase, previous));
    }

    public static FormationEvent reached(Instant timestamp, int n) {
        return at(timestamp, new CheckpointReached("checkpoint-awakening-" + n, "awakening-" + n,
                FormationPhase.AWAKENING));
    }

    public static FormationEvent completed(Instant timestamp, int n, long dwellSeconds) {
        return at(timestamp, new CheckpointCompleted("checkpoint-awakening-" + n, "awakening-" + n,
                FormationPhase.AWAKENING, "reflection-" + n, dwellSeconds));
    }

    public static FormationEvent reflection(Instant timestamp, int n, int words) {
        return at(timestamp, new ReflectionSubmitted("reflection-" + n, "checkpoint-awakening-" + n,
                ReflectionType.TEXT, words, 300));
    }
}
