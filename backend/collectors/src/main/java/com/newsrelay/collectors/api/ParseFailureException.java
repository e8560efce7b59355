package com.newsrelay.collectors.api;

public class ParseFailureException extends RuntimeException {
    private final String sourceName;

    public ParseFailureException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public ParseFailureException(String sourceName, String message) {
        this(sourceName, message, null);
    }

    public String sourceName() {
        return sourceName;
    }
}
