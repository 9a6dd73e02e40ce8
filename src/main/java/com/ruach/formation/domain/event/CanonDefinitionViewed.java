package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;

public final class CanonDefinitionViewed implements EventPayload {

    private final String axiomId;
    private final String term;
    private final String context;

    /**
     * @param context where in the content the definition was opened, may be null
     */
    public CanonDefinitionViewed(String axiomId, String term, String context) {
        this.axiomId = PayloadChecks.requireText(axiomId, "axiomId");
        this.term = PayloadChecks.requireText(term, "term");
        this.context = context;
    }

    @Override
    public EventType eventType() {
        return EventType.CANON_DEFINITION_VIEWED;
    }

    public String getAxiomId() {
        return axiomId;
    }

    public String getTerm() {
        return term;
    }

    public String getContext() {
        return context;
    }
}
