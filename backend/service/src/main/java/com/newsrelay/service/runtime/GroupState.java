package com.newsrelay.service.runtime;

public enum GroupState {
    IDLE,
    FETCHING,
    FILTERING,
    DELIVERING,
    SLEEPING
}
