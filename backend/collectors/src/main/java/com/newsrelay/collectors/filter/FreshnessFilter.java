package com.newsrelay.collectors.filter;

import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.FreshnessPolicy;

import java.time.Instant;

public class FreshnessFilter {
    /**
     * Fresh iff {@code publishedAt} lies in {@code [now - tolerance(section), now + futureSkew]}.
     * Articles without a parseable date and policies that do not enforce freshness always pass.
     */
    public boolean isFresh(Article article, FreshnessPolicy policy, Instant now) {
        if (!policy.enforceFreshness() || article.publishedAt() == null) {
            return true;
        }
        Instant oldest = now.minus(policy.toleranceFor(article.section()));
        Instant newest = now.plus(policy.futureSkew());
        return !article.publishedAt().isBefore(oldest) && !article.publishedAt().isAfter(newest);
    }
}
