package com.newsrelay.collectors.api;

import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceKind;

import java.util.List;

/**
 * Turns a fetched document into normalized articles, in document order. Implementations
 * hold no state between calls.
 */
public interface SourceAdapter {
    SourceKind kind();

    /**
     * @param baseUrl URL the payload was fetched from; relative links resolve against it
     * @throws ParseFailureException when the document as a whole cannot be read
     */
    List<Article> parse(String payload, SourceConfig source, String baseUrl);

    default List<Article> parse(String payload, SourceConfig source) {
        String baseUrl = source.endpoints().isEmpty() ? "" : source.endpoints().get(0);
        return parse(payload, source, baseUrl);
    }
}
