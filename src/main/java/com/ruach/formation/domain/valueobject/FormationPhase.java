package com.ruach.formation.domain.valueobject;

/**
 * The five sequential stages of the formation journey.
 * <p>
 * Declaration order is the progression order. Transitions only move
 * forward one step at a time; STEWARDSHIP is terminal.
 * </p>
 *
 * <pre>
 * State Machine Flow:
 *   AWAKENING → SEPARATION → DISCERNMENT → COMMISSION → STEWARDSHIP
 * </pre>
 */
public enum FormationPhase {

    /** Reorient belief around Scripture as authority - initial phase */
    AWAKENING,

    /** Separate from inherited assumptions */
    SEPARATION,

    /** Learn to distinguish God's voice */
    DISCERNMENT,

    /** Receive and accept a commission */
    COMMISSION,

    /** Steward what was received - terminal phase */
    STEWARDSHIP;

    /**
     * @return the phase that follows this one, or null if terminal
     */
    public FormationPhase next() {
        if (isTerminal()) {
            return null;
        }
        return values()[ordinal() + 1];
    }

    /**
     * @return true if no forward transition is defined
     */
    public boolean isTerminal() {
        return this == STEWARDSHIP;
    }

    /**
     * Checks if this phase is the same as or later than the given one.
     *
     * @param other phase to compare against
     * @return true if this phase has been reached once {@code other} has
     */
    public boolean isAtLeast(FormationPhase other) {
        return ordinal() >= other.ordinal();
    }

    /**
     * Lowercase slug used in checkpoint ids, e.g. {@code checkpoint-awakening-1}.
     */
    public String slug() {
        return name().toLowerCase();
    }

    /**
     * Resolves a phase from its slug or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no phase
     */
    public static FormationPhase fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("phase cannot be null or blank");
        }
        return FormationPhase.valueOf(value.trim().toUpperCase());
    }
}
