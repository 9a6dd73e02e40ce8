package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.ReadinessDimension;

/**
 * Levels are carried as names because the pace dimension uses
 * {@code PaceStatus} while the others use {@code ReadinessLevel}.
 */
public final class ReadinessLevelChanged implements EventPayload {

    private final ReadinessDimension dimension;
    private final String previousLevel;
    private final String newLevel;
    private final String reason;

    public ReadinessLevelChanged(ReadinessDimension dimension, String previousLevel,
            String newLevel, String reason) {
        this.dimension = PayloadChecks.requireValue(dimension, "dimension");
        this.previousLevel = PayloadChecks.requireText(previousLevel, "previousLevel");
        this.newLevel = PayloadChecks.requireText(newLevel, "newLevel");
        this.reason = PayloadChecks.requireText(reason, "reason");
    }

    @Override
    public EventType eventType() {
        return EventType.READINESS_LEVEL_CHANGED;
    }

    public ReadinessDimension getDimension() {
        return dimension;
    }

    public String getPreviousLevel() {
        return previousLevel;
    }

    public String getNewLevel() {
        return newLevel;
    }

    public String getReason() {
        return reason;
    }
}
