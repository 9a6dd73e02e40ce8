package com.ruach.formation.domain.catalog;

import com.ruach.formation.domain.valueobject.FormationPhase;

/**
 * Static gating data for one phase: how long a user must stay and how many
 * of the phase's checkpoints must be completed before moving on.
 */
public final class PhaseDefinition {

    private final FormationPhase phase;
    private final String title;
    private final int minimumDays;
    private final int requiredCheckpoints;

    public PhaseDefinition(FormationPhase phase, String title, int minimumDays, int requiredCheckpoints) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (minimumDays < 0 || requiredCheckpoints < 0) {
            throw new IllegalArgumentException("minimumDays and requiredCheckpoints must be >= 0");
        }
        this.phase = phase;
        this.title = title;
        this.minimumDays = minimumDays;
        this.requiredCheckpoints = requiredCheckpoints;
    }

    public FormationPhase getPhase() {
        return phase;
    }

    public String getTitle() {
        return title;
    }

    public int getMinimumDays() {
        return minimumDays;
    }

    public int getRequiredCheckpoints() {
        return requiredCheckpoints;
    }
}
