package com.newsrelay.collectors.filter;

import com.newsrelay.core.model.Article;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Assigns a section to articles whose source declares {@code AUTO}: link path markers
 * first, then content keywords.
 */
public class SectionClassifier {
    public static final String STOCK_MARKET = "STOCK-MARKET";
    public static final String CRYPTOCURRENCY = "CRYPTOCURRENCY";
    public static final String FOREX = "FOREX";
    public static final String COMMODITIES = "COMMODITIES";
    public static final String ECONOMIC_INDICATORS = "ECONOMIC-INDICATORS";
    public static final String EARNINGS = "EARNINGS";
    public static final String BREAKING_NEWS = "BREAKING-NEWS";

    private static final Map<String, String> PATH_MARKERS = new LinkedHashMap<>();
    private static final Map<String, List<String>> CONTENT_KEYWORDS = new LinkedHashMap<>();

    static {
        PATH_MARKERS.put("economic-indicators", ECONOMIC_INDICATORS);
        PATH_MARKERS.put("stock-market-news", STOCK_MARKET);
        PATH_MARKERS.put("commodities-news", COMMODITIES);
        PATH_MARKERS.put("forex-news", FOREX);
        PATH_MARKERS.put("cryptocurrency-news", CRYPTOCURRENCY);
        PATH_MARKERS.put("earnings", EARNINGS);

        CONTENT_KEYWORDS.put(CRYPTOCURRENCY, List.of("bitcoin", "crypto", "ethereum", "blockchain"));
        CONTENT_KEYWORDS.put(FOREX, List.of("dollar", "forex", "currency", "exchange rate", "yen", "euro"));
        CONTENT_KEYWORDS.put(COMMODITIES, List.of("oil", "gold", "crude", "silver", "opec", "natural gas"));
        CONTENT_KEYWORDS.put(EARNINGS, List.of("earnings", "quarterly results", "revenue", "eps"));
        CONTENT_KEYWORDS.put(ECONOMIC_INDICATORS, List.of("gdp", "inflation", "cpi", "unemployment", "jobs report", "pmi"));
        CONTENT_KEYWORDS.put(STOCK_MARKET, List.of("stock", "nasdaq", "dow", "s&p", "shares"));
    }

    public String classify(Article article) {
        String link = article.link().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> marker : PATH_MARKERS.entrySet()) {
            if (link.contains(marker.getKey())) {
                return marker.getValue();
            }
        }
        if (link.contains("economy-news")) {
            return containsAny(content(article), CONTENT_KEYWORDS.get(FOREX)) ? FOREX : ECONOMIC_INDICATORS;
        }
        String content = content(article);
        for (Map.Entry<String, List<String>> entry : CONTENT_KEYWORDS.entrySet()) {
            if (containsAny(content, entry.getValue())) {
                return entry.getKey();
            }
        }
        return BREAKING_NEWS;
    }

    public Article applyTo(Article article) {
        return article.withSection(classify(article));
    }

    private static String content(Article article) {
        return (article.title() + " " + (article.summary() == null ? "" : article.summary())).toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String content, List<String> keywords) {
        return keywords.stream().anyMatch(content::contains);
    }
}
