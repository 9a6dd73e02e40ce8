package com.ruach.formation.domain.valueobject;

/**
 * Kinds of gated content a ContentUnlocked/ContentGated event can refer to.
 */
public enum ContentType {

    /** Canon axiom */
    CANON,

    COURSE,

    /** Cannon release */
    CANNON,

    SECTION
}
