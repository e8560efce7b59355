package com.newsrelay.service.delivery;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
