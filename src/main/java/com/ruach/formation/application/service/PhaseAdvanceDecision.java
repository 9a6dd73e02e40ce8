package com.ruach.formation.application.service;

import com.ruach.formation.domain.valueobject.FormationPhase;

/**
 * Whether the current phase's gate is met, with the numbers behind it.
 *
 * @param nextPhase null when the current phase is terminal
 */
public record PhaseAdvanceDecision(
        FormationPhase currentPhase,
        FormationPhase nextPhase,
        long daysInPhase,
        int requiredDays,
        int checkpointsCompleted,
        int requiredCheckpoints) {

    /**
     * Conjunctive: checkpoint count AND elapsed days.
     */
    public boolean canAdvance() {
        return nextPhase != null
                && checkpointsCompleted >= requiredCheckpoints
                && daysInPhase >= requiredDays;
    }
}
