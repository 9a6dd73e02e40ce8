package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.PauseReason;
import com.ruach.formation.domain.valueobject.PauseSeverity;

public final class PauseTriggered implements EventPayload {

    private final PauseReason reason;
    private final String context;
    private final PauseSeverity severity;

    /**
     * @param context human-readable explanation shown to the user
     */
    public PauseTriggered(PauseReason reason, String context, PauseSeverity severity) {
        this.reason = PayloadChecks.requireValue(reason, "reason");
        this.context = PayloadChecks.requireText(context, "context");
        this.severity = PayloadChecks.requireValue(severity, "severity");
    }

    @Override
    public EventType eventType() {
        return EventType.PAUSE_TRIGGERED;
    }

    public PauseReason getReason() {
        return reason;
    }

    public String getContext() {
        return context;
    }

    public PauseSeverity getSeverity() {
        return severity;
    }
}
