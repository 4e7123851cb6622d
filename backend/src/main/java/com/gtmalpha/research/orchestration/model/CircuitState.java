package com.gtmalpha.research.orchestration.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
