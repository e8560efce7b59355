package com.newsrelay.collectors.fetch;

public enum FetchFailureKind {
    TIMEOUT,
    REJECTED,
    EMPTY
}
