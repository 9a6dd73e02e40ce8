package com.ruach.formation.application.port.in;

import com.ruach.formation.domain.entity.EventMetadata;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.valueobject.CovenantType;

/**
 * Primary (inbound) port: user activity that moves a journey forward
 * without a reflection.
 * <p>
 * Each operation appends one or more events and returns the primary one.
 * </p>
 */
public interface RecordActivityUseCase {

    FormationEvent enterCovenant(String userId, CovenantType covenantType, EventMetadata metadata);

    /**
     * @throws IllegalArgumentException if the checkpoint is not in the catalog
     */
    FormationEvent reachCheckpoint(String userId, String checkpointId, EventMetadata metadata);

    FormationEvent viewSection(String userId, String sectionId, long dwellTimeSeconds, EventMetadata metadata);

    /**
     * @throws IllegalArgumentException if the axiom is not in the catalog
     */
    FormationEvent viewCanonDefinition(String userId, String axiomId, String term, String context,
            EventMetadata metadata);

    FormationEvent citeAxiom(String userId, String axiomId, String citationContext, EventMetadata metadata);

    /**
     * Records an activity event produced by another service. Section views,
     * checkpoint arrivals, canon views and citations go through the same
     * checks as the operations above; analyzer results are stored as is.
     * Idempotent on the event id.
     *
     * @return the stored event, a ContentGated event for a locked axiom
     * @throws IllegalArgumentException for engine-issued, completion,
     *                                  submission and covenant events
     */
    FormationEvent record(FormationEvent event);

    /**
     * Advances the user to the next phase when the current phase's gate is
     * met. Does nothing otherwise.
     *
     * @return true if the phase changed
     */
    boolean advancePhase(String userId);

    /**
     * Re-derives readiness indicators and appends the resulting
     * ReadinessLevelChanged / FormationGapDetected events.
     *
     * @return number of events appended
     */
    int refreshReadiness(String userId);
}
