package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.FormationPhase;

public final class PhaseCompleted implements EventPayload {

    private final FormationPhase phase;
    private final long daysInPhase;
    private final int checkpointsCompleted;
    private final int reflectionsSubmitted;

    public PhaseCompleted(FormationPhase phase, long daysInPhase,
            int checkpointsCompleted, int reflectionsSubmitted) {
        this.phase = PayloadChecks.requireValue(phase, "phase");
        this.daysInPhase = PayloadChecks.requireNonNegative(daysInPhase, "daysInPhase");
        this.checkpointsCompleted = (int) PayloadChecks.requireNonNegative(checkpointsCompleted,
                "checkpointsCompleted");
        this.reflectionsSubmitted = (int) PayloadChecks.requireNonNegative(reflectionsSubmitted,
                "reflectionsSubmitted");
    }

    @Override
    public EventType eventType() {
        return EventType.PHASE_COMPLETED;
    }

    public FormationPhase getPhase() {
        return phase;
    }

    public long getDaysInPhase() {
        return daysInPhase;
    }

    public int getCheckpointsCompleted() {
        return checkpointsCompleted;
    }

    public int getReflectionsSubmitted() {
        return reflectionsSubmitted;
    }
}
