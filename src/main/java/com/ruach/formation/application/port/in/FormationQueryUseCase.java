package com.ruach.formation.application.port.in;

import java.util.List;

import com.ruach.formation.application.service.AxiomUnlockResult;
import com.ruach.formation.application.service.PhaseAdvanceDecision;
import com.ruach.formation.domain.entity.FormationState;
import com.ruach.formation.domain.entity.ReadinessIndicators;

/**
 * Primary (inbound) port: read side of a journey. Every query rebuilds the
 * state from the event log.
 */
public interface FormationQueryUseCase {

    /**
     * @return current state, with daysInPhase measured against the clock
     */
    FormationState getState(String userId);

    /**
     * @return indicators derived now from state and reflection history
     */
    ReadinessIndicators getReadiness(String userId);

    /**
     * @return every catalog axiom with its unlock status, ordered by title
     */
    List<AxiomUnlockResult> getAxiomStatuses(String userId);

    /**
     * @return the axiom's status, or null if the id is not in the catalog
     */
    AxiomUnlockResult getAxiomStatus(String userId, String axiomId);

    PhaseAdvanceDecision getPhaseStatus(String userId);
}
