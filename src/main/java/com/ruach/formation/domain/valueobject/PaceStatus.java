package com.ruach.formation.domain.valueobject;

/**
 * How the user's cadence compares to the phase's expected rhythm.
 */
public enum PaceStatus {

    /** Checkpoints completed faster than the phase allows */
    TOO_FAST,

    APPROPRIATE,

    /** No activity within the configured inactivity window */
    STALLED
}
