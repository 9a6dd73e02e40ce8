package com.ruach.formation.domain.valueobject;

/**
 * Classification attached to a reflection by the external analyzer.
 */
public enum DoctrinalSoundness {
    SOUND,
    UNCLEAR,
    CONCERNING
}
