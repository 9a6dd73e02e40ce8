package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.CovenantType;
import com.ruach.formation.domain.valueobject.EventType;

public final class CovenantEntered implements EventPayload {

    private final CovenantType covenantType;
    private final boolean acknowledgedTerms;

    public CovenantEntered(CovenantType covenantType, boolean acknowledgedTerms) {
        this.covenantType = PayloadChecks.requireValue(covenantType, "covenantType");
        this.acknowledgedTerms = acknowledgedTerms;
    }

    @Override
    public EventType eventType() {
        return EventType.COVENANT_ENTERED;
    }

    public CovenantType getCovenantType() {
        return covenantType;
    }

    public boolean isAcknowledgedTerms() {
        return acknowledgedTerms;
    }
}
