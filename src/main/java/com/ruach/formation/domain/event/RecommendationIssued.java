package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.EventType;
import com.ruach.formation.domain.valueobject.RecommendationType;

public final class RecommendationIssued implements EventPayload {

    private final RecommendationType recommendationType;
    private final String targetId;
    private final String reason;

    /**
     * @param targetId id of the recommended resource or section, may be null
     */
    public RecommendationIssued(RecommendationType recommendationType, String targetId, String reason) {
        this.recommendationType = PayloadChecks.requireValue(recommendationType, "recommendationType");
        this.targetId = targetId;
        this.reason = PayloadChecks.requireText(reason, "reason");
    }

    @Override
    public EventType eventType() {
        return EventType.RECOMMENDATION_ISSUED;
    }

    public RecommendationType getRecommendationType() {
        return recommendationType;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getReason() {
        return reason;
    }
}
