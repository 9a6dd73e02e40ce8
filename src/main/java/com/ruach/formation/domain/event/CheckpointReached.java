package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.FormationPhase;

public final class CheckpointReached implements EventPayload {

    private final String checkpointId;
    private final String sectionId;
    private final FormationPhase phase;

    public CheckpointReached(String checkpointId, String sectionId, FormationPhase phase) {
        this.checkpointId = PayloadChecks.requireText(checkpointId, "checkpointId");
        this.sectionId = PayloadChecks.requireText(sectionId, "sectionId");
        this.phase = PayloadChecks.requireValue(phase, "phase");
    }

    @Override
    public EventType eventType() {
        return EventType.CHECKPOINT_REACHED;
    }

    public String getCheckpointId() {
        return checkpointId;
    }

    public String getSectionId() {
        return sectionId;
    }

    public FormationPhase getPhase() {
        return phase;
    }
}
