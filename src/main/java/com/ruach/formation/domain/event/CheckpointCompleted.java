package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.FormationPhase;

public final class CheckpointCompleted implements EventPayload {

    private final String checkpointId;
    private final String sectionId;
    private final FormationPhase phase;
    private final String reflectionId;
    private final long timeSinceReached;

    /**
     * @param reflectionId     reflection that completed the checkpoint
     * @param timeSinceReached seconds between reaching and completing
     */
    public CheckpointCompleted(String checkpointId, String sectionId, FormationPhase phase,
            String reflectionId, long timeSinceReached) {
        this.checkpointId = PayloadChecks.requireText(checkpointId, "checkpointId");
        this.sectionId = PayloadChecks.requireText(sectionId, "sectionId");
        this.phase = PayloadChecks.requireValue(phase, "phase");
        this.reflectionId = PayloadChecks.requireText(reflectionId, "reflectionId");
        this.timeSinceReached = PayloadChecks.requireNonNegative(timeSinceReached, "timeSinceReached");
    }

    @Override
    public EventType eventType() {
        return EventType.CHECKPOINT_COMPLETED;
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

    public String getReflectionId() {
        return reflectionId;
    }

    public long getTimeSinceReached() {
        return timeSinceReached;
    }
}
