package com.ruach.formation.domain.valueobject;

/**
 * Maturity scale shared by reflection depth and canon engagement.
 * <p>
 * Declaration order is the escalation order.
 * </p>
 */
public enum ReadinessLevel {

    EMERGING,
    DEVELOPING,
    MATURING,
    ESTABLISHED;

    /**
     * @return true if this level is the same as or above {@code other}
     */
    public boolean isAtLeast(ReadinessLevel other) {
        return ordinal() >= other.ordinal();
    }
}
