package com.ruach.formation.domain.valueobject;

public enum RecommendationType {
    RESOURCE,
    REVISIT,
    PAUSE,
    CONNECT
}
