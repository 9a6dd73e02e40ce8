package com.ruach.formation.domain.valueobject;

public enum PauseSeverity {
    SUGGESTION,
    WARNING,
    GATE
}
