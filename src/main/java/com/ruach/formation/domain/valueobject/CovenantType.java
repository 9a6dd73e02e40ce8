package com.ruach.formation.domain.valueobject;

/**
 * The covenant a user entered with.
 */
public enum CovenantType {

    /** Full guided formation journey through all phases */
    FORMATION_JOURNEY,

    /** Browse resources without the structured journey */
    RESOURCE_EXPLORER
}
