package com.ruach.formation.domain.valueobject;

public enum GapType {
    THEOLOGICAL,
    PRACTICAL,
    RELATIONAL
}
