package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.DoctrinalSoundness;
import com.ruach.formation.domain.valueobject.EventType;

/**
 * Indicators attached to a reflection by the external analyzer.
 */
public final class ReflectionAnalyzed implements EventPayload {

    private final String reflectionId;
    private final double depthScore;
    private final boolean regurgitation;
    private final boolean showsWrestling;
    private final DoctrinalSoundness doctrinalSoundness;
    private final String recommendedAction;

    /**
     * @param depthScore        0.0 to 1.0
     * @param recommendedAction e.g. {@code unlock_next}, {@code suggest_resource}
     */
    public ReflectionAnalyzed(String reflectionId, double depthScore, boolean regurgitation,
            boolean showsWrestling, DoctrinalSoundness doctrinalSoundness, String recommendedAction) {
        if (depthScore < 0.0 || depthScore > 1.0) {
            throw new IllegalArgumentException("depthScore must be between 0 and 1, got: " + depthScore);
        }
        this.reflectionId = PayloadChecks.requireText(reflectionId, "reflectionId");
        this.depthScore = depthScore;
        this.regurgitation = regurgitation;
        this.showsWrestling = showsWrestling;
        this.doctrinalSoundness = PayloadChecks.requireValue(doctrinalSoundness, "doctrinalSoundness");
        this.recommendedAction = recommendedAction != null ? recommendedAction : "";
    }

    @Override
    public EventType eventType() {
        return EventType.REFLECTION_ANALYZED;
    }

    public String getReflectionId() {
        return reflectionId;
    }

    public double getDepthScore() {
        return depthScore;
    }

    public boolean isRegurgitation() {
        return regurgitation;
    }

    public boolean isShowsWrestling() {
        return showsWrestling;
    }

    public DoctrinalSoundness getDoctrinalSoundness() {
        return doctrinalSoundness;
    }

    public String getRecommendedAction() {
        return recommendedAction;
    }
}
