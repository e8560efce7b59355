package com.newsrelay.collectors.filter;

import com.newsrelay.core.model.Article;

import java.util.Locale;

public class RelevanceScorer {
    public static final int RELEVANCE_THRESHOLD = 1;

    private final KeywordTaxonomy taxonomy;

    public RelevanceScorer(KeywordTaxonomy taxonomy) {
        this.taxonomy = taxonomy;
    }

    /**
     * Sum of category weights over every keyword found (substring match) in the
     * lower-cased title and summary.
     */
    public int score(Article article) {
        String content = (article.title() + " " + (article.summary() == null ? "" : article.summary()))
                .toLowerCase(Locale.ROOT);
        int score = 0;
        for (KeywordCategory category : taxonomy.categories()) {
            for (String keyword : category.keywords()) {
                if (content.contains(keyword)) {
                    score += category.weight();
                }
            }
        }
        return score;
    }

    public boolean isRelevant(Article article) {
        return taxonomy.isEmpty() || score(article) >= RELEVANCE_THRESHOLD;
    }
}
