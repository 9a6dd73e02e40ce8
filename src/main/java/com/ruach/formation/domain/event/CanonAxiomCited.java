package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;

public final class CanonAxiomCited implements EventPayload {

    private final String axiomId;
    private final String citationContext;

    /**
     * @param citationContext e.g. "in reflection", "in discussion"
     */
    public CanonAxiomCited(String axiomId, String citationContext) {
        this.axiomId = PayloadChecks.requireText(axiomId, "axiomId");
        this.citationContext = PayloadChecks.requireText(citationContext, "citationContext");
    }

    @Override
    public EventType eventType() {
        return EventType.CANON_AXIOM_CITED;
    }

    public String getAxiomId() {
        return axiomId;
    }

    public String getCitationContext() {
        return citationContext;
    }
}
