package com.newsrelay.collectors.html;

import com.newsrelay.collectors.api.SourceAdapter;
import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.HtmlSelectors;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceKind;
import com.newsrelay.core.util.HtmlUtils;
import com.newsrelay.core.util.Timestamps;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Extracts article blocks from a listing page using the source's {@link HtmlSelectors}.
 * The first block selector that matches more than {@code minBlockMatches} elements is
 * used; a page where none does yields no articles.
 */
public class HtmlSourceAdapter implements SourceAdapter {
    private static final Logger LOGGER = Logger.getLogger(HtmlSourceAdapter.class.getName());
    private static final int MIN_TITLE_LENGTH = 10;
    private static final int SUMMARY_LIMIT = 300;
    private static final Pattern PUBLISHER_PREFIX = Pattern.compile("^\\s*Investing\\.com\\s*[-–—]+\\s*");

    @Override
    public SourceKind kind() {
        return SourceKind.HTML;
    }

    @Override
    public List<Article> parse(String payload, SourceConfig source, String baseUrl) {
        Document document = Jsoup.parse(payload, baseUrl);
        HtmlSelectors selectors = source.selectors();
        Elements blocks = selectBlocks(document, selectors, source.sourceName());
        if (blocks.isEmpty()) {
            LOGGER.fine("No article blocks matched for " + source.sourceName());
            return List.of();
        }

        int limit = source.maxArticlesPerCycle() * 2;
        Map<String, Article> articles = new LinkedHashMap<>();
        for (Element block : blocks) {
            if (articles.size() >= limit) {
                break;
            }
            toArticle(block, selectors, source).ifPresent(article -> articles.putIfAbsent(article.id(), article));
        }
        return List.copyOf(articles.values());
    }

    private static Elements selectBlocks(Document document, HtmlSelectors selectors, String sourceName) {
        for (String selector : selectors.blockSelectors()) {
            try {
                Elements matches = document.select(selector);
                if (matches.size() > selectors.minBlockMatches()) {
                    LOGGER.fine("Selector '" + selector + "' matched " + matches.size() + " blocks for " + sourceName);
                    return matches;
                }
            } catch (Selector.SelectorParseException e) {
                LOGGER.warning("Invalid block selector '" + selector + "' for " + sourceName + ": " + e.getMessage());
            }
        }
        return new Elements();
    }

    private Optional<Article> toArticle(Element block, HtmlSelectors selectors, SourceConfig source) {
        Optional<Element> titleElement = findTitle(block, selectors);
        if (titleElement.isEmpty()) {
            return Optional.empty();
        }
        String title = HtmlUtils.normalizeWhitespace(titleElement.get().text());
        String link = findLink(block, titleElement.get());
        if (link.isBlank()) {
            return Optional.empty();
        }

        String summary = findSummary(block, selectors, title).orElse(null);
        String imageUrl = findImage(block, selectors).orElse(null);
        String rawPublished = Optional.ofNullable(block.selectFirst("time[datetime]"))
                .map(time -> time.attr("datetime"))
                .filter(value -> !value.isBlank())
                .orElse(null);
        Instant publishedAt = Timestamps.parse(rawPublished).orElse(null);

        return Optional.of(Article.of(title, link, summary, publishedAt, rawPublished,
                source.section(), imageUrl, source.sourceName()));
    }

    private static Optional<Element> findTitle(Element block, HtmlSelectors selectors) {
        for (String selector : selectors.titleSelectors()) {
            Element candidate = safeSelectFirst(block, selector);
            if (candidate != null && candidate.text().trim().length() > MIN_TITLE_LENGTH) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static String findLink(Element block, Element titleElement) {
        Element anchor;
        if (titleElement.is("a[href]")) {
            anchor = titleElement;
        } else if (titleElement.selectFirst("a[href]") != null) {
            anchor = titleElement.selectFirst("a[href]");
        } else if (block.is("a[href]")) {
            anchor = block;
        } else {
            anchor = block.selectFirst("a[href]");
        }
        if (anchor == null) {
            return "";
        }
        String absolute = anchor.absUrl("href");
        return HtmlUtils.isAllowedLink(absolute) ? absolute : "";
    }

    private static Optional<String> findSummary(Element block, HtmlSelectors selectors, String title) {
        for (String selector : selectors.summarySelectors()) {
            Element candidate = safeSelectFirst(block, selector);
            if (candidate == null) {
                continue;
            }
            String text = PUBLISHER_PREFIX.matcher(HtmlUtils.normalizeWhitespace(candidate.text())).replaceFirst("");
            if (!text.isBlank() && !text.equals(title)) {
                return Optional.of(HtmlUtils.truncate(text, SUMMARY_LIMIT));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> findImage(Element block, HtmlSelectors selectors) {
        for (String selector : selectors.imageSelectors()) {
            Element image = safeSelectFirst(block, selector);
            if (image == null) {
                continue;
            }
            for (String attribute : List.of("src", "data-src")) {
                String url = image.absUrl(attribute);
                if (!url.isBlank() && HtmlUtils.isAllowedLink(url)) {
                    return Optional.of(url);
                }
            }
        }
        return Optional.empty();
    }

    private static Element safeSelectFirst(Element root, String selector) {
        try {
            return root.selectFirst(selector);
        } catch (Selector.SelectorParseException e) {
            LOGGER.fine("Invalid selector '" + selector + "': " + e.getMessage());
            return null;
        }
    }
}
