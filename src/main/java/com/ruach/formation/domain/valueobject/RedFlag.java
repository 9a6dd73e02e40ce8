package com.ruach.formation.domain.valueobject;

/**
 * Concerning behavioral patterns detected from the event history.
 * <p>
 * Red flags are advisory. They never block progression on their own.
 * </p>
 */
public enum RedFlag {

    /** Checkpoints completed with dwell time at or under the minimum */
    SPEED_RUNNING,

    /** Checkpoints reached but left incomplete past the grace window */
    MISSING_REFLECTIONS,

    /** Reflections short or flagged as regurgitation */
    SURFACE_ENGAGEMENT,

    /** No activity for the long inactivity threshold */
    DISENGAGED
}
