package com.ruach.formation.domain.valueobject;

public enum GapSeverity {
    MINOR,
    MODERATE,
    CRITICAL
}
