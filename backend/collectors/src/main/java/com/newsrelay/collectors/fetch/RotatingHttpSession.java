package com.newsrelay.collectors.fetch;

import java.net.http.HttpClient;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Shares one {@link HttpClient} between requests and replaces it after
 * {@code requestsPerSession} requests, dropping its pooled connections and cookies.
 */
public class RotatingHttpSession {
    private static final Logger LOGGER = Logger.getLogger(RotatingHttpSession.class.getName());

    private final Supplier<HttpClient> clientFactory;
    private final int requestsPerSession;
    private HttpClient current;
    private int requestsServed;
    private int rotations;

    public RotatingHttpSession(Supplier<HttpClient> clientFactory, int requestsPerSession) {
        this.clientFactory = clientFactory;
        this.requestsPerSession = Math.max(1, requestsPerSession);
    }

    public synchronized HttpClient client() {
        if (current == null || requestsServed >= requestsPerSession) {
            if (current != null) {
                rotations++;
                LOGGER.fine("Rotating HTTP session after " + requestsServed + " requests");
            }
            current = clientFactory.get();
            requestsServed = 0;
        }
        requestsServed++;
        return current;
    }

    public synchronized int rotations() {
        return rotations;
    }
}
