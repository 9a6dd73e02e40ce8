package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.FormationPhase;

public final class SectionViewed implements EventPayload {

    private final String sectionId;
    private final FormationPhase phase;
    private final long dwellTimeSeconds;

    public SectionViewed(String sectionId, FormationPhase phase, long dwellTimeSeconds) {
        this.sectionId = PayloadChecks.requireText(sectionId, "sectionId");
        this.phase = PayloadChecks.requireValue(phase, "phase");
        this.dwellTimeSeconds = PayloadChecks.requireNonNegative(dwellTimeSeconds, "dwellTimeSeconds");
    }

    @Override
    public EventType eventType() {
        return EventType.SECTION_VIEWED;
    }

    public String getSectionId() {
        return sectionId;
    }

    public FormationPhase getPhase() {
        return phase;
    }

    public long getDwellTimeSeconds() {
        return dwellTimeSeconds;
    }
}
