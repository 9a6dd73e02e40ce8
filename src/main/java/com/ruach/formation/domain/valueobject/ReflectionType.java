package com.ruach.formation.domain.valueobject;

public enum ReflectionType {
    TEXT,
    /** Transcribed voice recording */
    VOICE
}
