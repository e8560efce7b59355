package com.newsrelay.collectors.fetch;

import com.newsrelay.core.model.SourceConfig;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Built-in strategy catalogue. Sources refer to strategies by name; unknown names are
 * skipped with a warning.
 */
public final class FetchStrategies {
    private static final Logger LOGGER = Logger.getLogger(FetchStrategies.class.getName());

    public static final String DIRECT = "direct";
    public static final String FEED = "feed";
    public static final String MOBILE = "mobile";
    public static final String CRAWLER = "crawler";
    public static final String ALTERNATE = "alternate";

    static final String DESKTOP_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36";
    static final String MOBILE_AGENT =
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_2_1 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.2 Mobile/15E148 Safari/604.1";
    static final String CRAWLER_AGENT =
            "Mozilla/5.0 (compatible; Googlebot/2.1; +http://www.google.com/bot.html)";

    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String FEED_ACCEPT = "application/rss+xml, application/atom+xml, application/xml, text/xml";

    private final Duration timeout;

    public FetchStrategies(Duration timeout) {
        this.timeout = timeout;
    }

    public List<FetchStrategy> forSource(SourceConfig source) {
        List<FetchStrategy> strategies = new ArrayList<>();
        for (String name : source.strategies()) {
            switch (name.toLowerCase(Locale.ROOT)) {
                case DIRECT -> strategies.add(direct());
                case FEED -> strategies.add(feed());
                case MOBILE -> strategies.add(mobile());
                case CRAWLER -> strategies.add(crawler());
                case ALTERNATE -> {
                    if (source.alternateEndpoint() == null || source.alternateEndpoint().isBlank()) {
                        LOGGER.warning("Source " + source.sourceName() + " lists 'alternate' without alternateEndpoint");
                    } else {
                        strategies.add(alternate(source.alternateEndpoint()));
                    }
                }
                default -> LOGGER.warning("Unknown fetch strategy '" + name + "' for source " + source.sourceName());
            }
        }
        if (strategies.isEmpty()) {
            strategies.add(direct());
        }
        return List.copyOf(strategies);
    }

    public FetchStrategy direct() {
        return new FetchStrategy(DIRECT, timeout, Map.of(
                "User-Agent", DESKTOP_AGENT,
                "Accept", HTML_ACCEPT,
                "Accept-Language", "en-US,en;q=0.9"
        ));
    }

    public FetchStrategy feed() {
        return new FetchStrategy(FEED, timeout, Map.of(
                "User-Agent", DESKTOP_AGENT,
                "Accept", FEED_ACCEPT,
                "Accept-Language", "en-US,en;q=0.9"
        ));
    }

    public FetchStrategy mobile() {
        return new FetchStrategy(MOBILE, timeout, Map.of(
                "User-Agent", MOBILE_AGENT,
                "Accept", HTML_ACCEPT
        ), FetchStrategies::mobileHost);
    }

    public FetchStrategy crawler() {
        return new FetchStrategy(CRAWLER, timeout.multipliedBy(2), Map.of(
                "User-Agent", CRAWLER_AGENT,
                "Accept", "*/*"
        ));
    }

    public FetchStrategy alternate(String alternateEndpoint) {
        return new FetchStrategy(ALTERNATE, timeout, Map.of(
                "User-Agent", DESKTOP_AGENT,
                "Accept", HTML_ACCEPT
        ), ignored -> alternateEndpoint);
    }

    static String mobileHost(String url) {
        URI uri = URI.create(url);
        String host = uri.getHost();
        if (host == null || !host.startsWith("www.")) {
            return url;
        }
        return url.replaceFirst("://www\\.", "://m.");
    }
}
