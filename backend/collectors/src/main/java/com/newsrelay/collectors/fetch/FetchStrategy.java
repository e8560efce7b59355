package com.newsrelay.collectors.fetch;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One way of requesting a document: its own timeout, request headers and an optional
 * rewrite of the target URL.
 */
public record FetchStrategy(
        String name,
        Duration timeout,
        Map<String, String> headers,
        UnaryOperator<String> urlRewrite
) {
    public FetchStrategy {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(timeout, "timeout is required");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        urlRewrite = urlRewrite == null ? UnaryOperator.identity() : urlRewrite;
    }

    public FetchStrategy(String name, Duration timeout, Map<String, String> headers) {
        this(name, timeout, headers, UnaryOperator.identity());
    }

    public String targetUrl(String url) {
        return urlRewrite.apply(url);
    }
}
