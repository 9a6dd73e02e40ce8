package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.GapSeverity;
import com.ruach.formation.domain.valueobject.GapType;

public final class FormationGapDetected implements EventPayload {

    private final GapType gapType;
    private final String area;
    private final GapSeverity severity;
    private final String recommendation;

    public FormationGapDetected(GapType gapType, String area, GapSeverity severity, String recommendation) {
        this.gapType = PayloadChecks.requireValue(gapType, "gapType");
        this.area = PayloadChecks.requireText(area, "area");
        this.severity = PayloadChecks.requireValue(severity, "severity");
        this.recommendation = PayloadChecks.requireText(recommendation, "recommendation");
    }

    @Override
    public EventType eventType() {
        return EventType.FORMATION_GAP_DETECTED;
    }

    public GapType getGapType() {
        return gapType;
    }

    public String getArea() {
        return area;
    }

    public GapSeverity getSeverity() {
        return severity;
    }

    public String getRecommendation() {
        return recommendation;
    }
}
