package com.ruach.formation.application.service;

import java.time.Instant;
import java.util.List;

import com.ruach.formation.domain.catalog.PhaseCatalog;
import com.ruach.formation.domain.catalog.PhaseDefinition;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.event.EventPayload;
import com.ruach.formation.domain.event.PhaseCompleted;
import com.ruach.formation.domain.event.PhaseStarted;

/**
 * Gate between phases: forward one step at a time, once both the required
 * checkpoint count and the minimum days in phase are reached.
 */
public class PhaseProgressionPolicy {

    private final PhaseCatalog phaseCatalog;

    public PhaseProgressionPolicy(PhaseCatalog phaseCatalog) {
        if (phaseCatalog == null)
            throw new IllegalArgumentException("phaseCatalog cannot be null");
        this.phaseCatalog = phaseCatalog;
    }

    public PhaseAdvanceDecision evaluateAdvance(FormationState state, Instant now) {
        PhaseDefinition definition = phaseCatalog.get(state.getCurrentPhase());
        FormationState current = state.withDaysInPhaseAt(now);
        return new PhaseAdvanceDecision(
                current.getCurrentPhase(),
                current.getCurrentPhase().next(),
                current.getDaysInPhase(),
                definition.getMinimumDays(),
                current.countCompletedInPhase(current.getCurrentPhase()),
                definition.getRequiredCheckpoints());
    }

    /**
     * @return PhaseCompleted followed by PhaseStarted
     * @throws IllegalStateException if the decision does not allow advancing
     */
    public List<EventPayload> advancePayloads(FormationState state, PhaseAdvanceDecision decision) {
        if (!decision.canAdvance()) {
            throw new IllegalStateException("Phase gate not met for " + decision.currentPhase()
                    + " user " + state.getUserId());
        }
        return List.of(
                new PhaseCompleted(decision.currentPhase(), decision.daysInPhase(),
                        decision.checkpointsCompleted(), state.getReflectionsSubmitted()),
                new PhaseStarted(decision.nextPhase(), decision.currentPhase()));
    }
}
