package com.newsrelay.collectors.fetch;

/**
 * Raised when every strategy of a chain failed. {@link #kind()} is the failure kind of
 * the last strategy tried.
 */
public class FetchFailureException extends RuntimeException {
    private final FetchFailureKind kind;
    private final String url;

    public FetchFailureException(FetchFailureKind kind, String url, String message) {
        super(message);
        this.kind = kind;
        this.url = url;
    }

    public FetchFailureKind kind() {
        return kind;
    }

    public String url() {
        return url;
    }
}
