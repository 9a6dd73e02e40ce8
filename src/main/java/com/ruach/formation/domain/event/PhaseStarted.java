package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.FormationPhase;

public final class PhaseStarted implements EventPayload {

    private final FormationPhase phase;
    private final FormationPhase previousPhase;

    /**
     * @param phase         phase being entered
     * @param previousPhase phase being left, null for the first phase
     */
    public PhaseStarted(FormationPhase phase, FormationPhase previousPhase) {
        this.phase = PayloadChecks.requireValue(phase, "phase");
        this.previousPhase = previousPhase;
    }

    @Override
    public EventType eventType() {
        return EventType.PHASE_STARTED;
    }

    public FormationPhase getPhase() {
        return phase;
    }

    public FormationPhase getPreviousPhase() {
        return previousPhase;
    }
}
