package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.FormationPhase;

public final class SectionCompleted implements EventPayload {

    private final String sectionId;
    private final FormationPhase phase;
    private final long totalDwellTimeSeconds;

    public SectionCompleted(String sectionId, FormationPhase phase, long totalDwellTimeSeconds) {
        this.sectionId = PayloadChecks.requireText(sectionId, "sectionId");
        this.phase = PayloadChecks.requireValue(phase, "phase");
        this.totalDwellTimeSeconds = PayloadChecks.requireNonNegative(totalDwellTimeSeconds,
                "totalDwellTimeSeconds");
    }

    @Override
    public EventType eventType() {
        return EventType.SECTION_COMPLETED;
    }

    public String getSectionId() {
        return sectionId;
    }

    public FormationPhase getPhase() {
        return phase;
    }

    public long getTotalDwellTimeSeconds() {
        return totalDwellTimeSeconds;
    }
}
