package com.newsrelay.core.model;

import java.util.List;

/**
 * Structural selectors for document-based sources. Block selectors are tried in order
 * until one matches more than {@code minBlockMatches} elements.
 */
public record HtmlSelectors(
        List<String> blockSelectors,
        List<String> titleSelectors,
        List<String> summarySelectors,
        List<String> imageSelectors,
        int minBlockMatches
) {
    public static final List<String> DEFAULT_BLOCKS = List.of(
            "article[data-test-id]",
            "div[data-test-id=article-item]",
            "article",
            "div[class*=article]",
            "a[class*=articleItem]",
            "div[class*=story]",
            "div[class*=news]",
            ".js-article-item"
    );
    public static final List<String> DEFAULT_TITLES = List.of("h3", "h2", "h4", "a", ".title", "[title]");
    public static final List<String> DEFAULT_SUMMARIES = List.of("p", ".summary", ".description");
    public static final List<String> DEFAULT_IMAGES = List.of("img[src]", "img[data-src]", ".image img", ".thumbnail img");

    public HtmlSelectors {
        blockSelectors = blockSelectors == null || blockSelectors.isEmpty() ? DEFAULT_BLOCKS : List.copyOf(blockSelectors);
        titleSelectors = titleSelectors == null || titleSelectors.isEmpty() ? DEFAULT_TITLES : List.copyOf(titleSelectors);
        summarySelectors = summarySelectors == null || summarySelectors.isEmpty()
                ? DEFAULT_SUMMARIES
                : List.copyOf(summarySelectors);
        imageSelectors = imageSelectors == null || imageSelectors.isEmpty() ? DEFAULT_IMAGES : List.copyOf(imageSelectors);
        minBlockMatches = minBlockMatches <= 0 ? 3 : minBlockMatches;
    }

    public static HtmlSelectors defaults() {
        return new HtmlSelectors(null, null, null, null, 0);
    }
}
