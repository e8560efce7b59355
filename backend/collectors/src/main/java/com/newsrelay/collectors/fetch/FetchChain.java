package com.newsrelay.collectors.fetch;

import com.newsrelay.core.util.Sleeper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tries an ordered list of {@link FetchStrategy}s against one URL until one returns a
 * usable document.
 *
 * <p>A strategy succeeds on HTTP 200 with a body of at least {@code minPayloadBytes}
 * bytes; later strategies are then never invoked. Any other outcome moves on to the next
 * strategy after a jittered backoff. When the list is exhausted a
 * {@link FetchFailureException} carrying the last failure kind is thrown.
 */
public class FetchChain {
    private static final Logger LOGGER = Logger.getLogger(FetchChain.class.getName());

    private final RotatingHttpSession session;
    private final Sleeper sleeper;
    private final Backoff backoff;
    private final int minPayloadBytes;

    public FetchChain(RotatingHttpSession session, Sleeper sleeper, Backoff backoff, int minPayloadBytes) {
        this.session = session;
        this.sleeper = sleeper;
        this.backoff = backoff;
        this.minPayloadBytes = Math.max(1, minPayloadBytes);
    }

    public FetchResult fetch(String url, List<FetchStrategy> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one fetch strategy is required");
        }
        FetchFailureKind lastKind = FetchFailureKind.REJECTED;
        String lastMessage = "no strategy attempted";
        for (int i = 0; i < strategies.size(); i++) {
            if (i > 0) {
                pause(backoff.delayFor(i - 1), url);
            }
            FetchStrategy strategy = strategies.get(i);
            String target = strategy.targetUrl(url);
            try {
                HttpResponse<String> response = send(target, strategy);
                int status = response.statusCode();
                String body = response.body() == null ? "" : response.body();
                if (status != 200) {
                    lastKind = FetchFailureKind.REJECTED;
                    lastMessage = "HTTP " + status + " via " + strategy.name();
                } else if (body.getBytes(StandardCharsets.UTF_8).length < minPayloadBytes) {
                    lastKind = FetchFailureKind.EMPTY;
                    lastMessage = "payload below " + minPayloadBytes + " bytes via " + strategy.name();
                } else {
                    return new FetchResult(body, strategy.name(), status, target);
                }
            } catch (HttpTimeoutException e) {
                lastKind = FetchFailureKind.TIMEOUT;
                lastMessage = "timeout via " + strategy.name();
            } catch (IOException | IllegalArgumentException e) {
                lastKind = FetchFailureKind.REJECTED;
                lastMessage = strategy.name() + ": " + describe(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchFailureException(FetchFailureKind.REJECTED, url, "interrupted during " + strategy.name());
            }
            LOGGER.fine("Strategy " + strategy.name() + " failed for " + target + ": " + lastMessage);
        }
        throw new FetchFailureException(lastKind, url, lastMessage);
    }

    private HttpResponse<String> send(String target, FetchStrategy strategy) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(target))
                .GET()
                .timeout(strategy.timeout());
        for (Map.Entry<String, String> header : strategy.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return session.client().send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private void pause(Duration delay, String url) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.log(Level.FINE, "Fetch backoff interrupted for " + url, e);
            throw new FetchFailureException(FetchFailureKind.REJECTED, url, "interrupted during backoff");
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
