package com.ruach.formation.domain.valueobject;

/**
 * Why the system asked the user to slow down.
 */
public enum PauseReason {

    SPEED_RUN_DETECTED,
    INSUFFICIENT_DWELL_TIME,
    MISSING_REFLECTIONS,
    SURFACE_ENGAGEMENT;

    /**
     * Maps the pause reason to the red flag it records, if any.
     * INSUFFICIENT_DWELL_TIME is a momentary nudge and records no flag.
     *
     * @return the matching red flag, or null
     */
    public RedFlag toRedFlag() {
        return switch (this) {
            case SPEED_RUN_DETECTED -> RedFlag.SPEED_RUNNING;
            case MISSING_REFLECTIONS -> RedFlag.MISSING_REFLECTIONS;
            case SURFACE_ENGAGEMENT -> RedFlag.SURFACE_ENGAGEMENT;
            case INSUFFICIENT_DWELL_TIME -> null;
        };
    }
}
