package com.newsrelay.collectors.filter;

import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.FreshnessPolicy;

import java.time.Instant;
import java.util.logging.Logger;

public class ArticleFilter {
    private static final Logger LOGGER = Logger.getLogger(ArticleFilter.class.getName());

    private final RelevanceScorer relevance;
    private final FreshnessFilter freshness;

    public ArticleFilter(KeywordTaxonomy taxonomy) {
        this(new RelevanceScorer(taxonomy), new FreshnessFilter());
    }

    public ArticleFilter(RelevanceScorer relevance, FreshnessFilter freshness) {
        this.relevance = relevance;
        this.freshness = freshness;
    }

    public boolean keep(Article article, FreshnessPolicy policy, Instant now) {
        if (!relevance.isRelevant(article)) {
            LOGGER.finer(() -> "Not relevant: " + article.title());
            return false;
        }
        if (!freshness.isFresh(article, policy, now)) {
            LOGGER.finer(() -> "Stale: " + article.title() + " published " + article.rawPublished());
            return false;
        }
        return true;
    }
}
