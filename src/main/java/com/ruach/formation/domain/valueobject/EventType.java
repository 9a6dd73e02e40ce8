package com.ruach.formation.domain.valueobject;

/**
 * Closed catalog of formation event kinds.
 * <p>
 * Every event in the log carries exactly one of these as its discriminant.
 * Names are past tense: they record what happened, not what should happen.
 * The wire name is the snake_case form stored in the {@code event_type}
 * column.
 * </p>
 */
public enum EventType {

    COVENANT_ENTERED("covenant_entered"),

    PHASE_STARTED("phase_started"),
    PHASE_COMPLETED("phase_completed"),

    SECTION_VIEWED("section_viewed"),
    SECTION_COMPLETED("section_completed"),

    CHECKPOINT_REACHED("checkpoint_reached"),
    CHECKPOINT_COMPLETED("checkpoint_completed"),

    REFLECTION_SUBMITTED("reflection_submitted"),
    REFLECTION_ANALYZED("reflection_analyzed"),

    CANON_DEFINITION_VIEWED("canon_definition_viewed"),
    CANON_AXIOM_CITED("canon_axiom_cited"),

    PAUSE_TRIGGERED("pause_triggered"),
    RECOMMENDATION_ISSUED("recommendation_issued"),
    CONTENT_UNLOCKED("content_unlocked"),
    CONTENT_GATED("content_gated"),

    READINESS_LEVEL_CHANGED("readiness_level_changed"),
    FORMATION_GAP_DETECTED("formation_gap_detected");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Checks if this event type is emitted by the system rather than by a
     * user action.
     *
     * @return true for interventions and milestone signals
     */
    public boolean isSystemIssued() {
        return switch (this) {
            case PAUSE_TRIGGERED, RECOMMENDATION_ISSUED, CONTENT_UNLOCKED, CONTENT_GATED,
                    READINESS_LEVEL_CHANGED, FORMATION_GAP_DETECTED, REFLECTION_ANALYZED -> true;
            default -> false;
        };
    }

    /**
     * Resolves an event type from either its wire name or its enum name.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static EventType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        for (EventType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown eventType: " + value);
    }
}
