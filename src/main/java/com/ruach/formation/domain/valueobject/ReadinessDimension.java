package com.ruach.formation.domain.valueobject;

/**
 * The readiness dimension a ReadinessLevelChanged event refers to.
 */
public enum ReadinessDimension {
    REFLECTION_DEPTH,
    PACE,
    CANON_ENGAGEMENT
}
