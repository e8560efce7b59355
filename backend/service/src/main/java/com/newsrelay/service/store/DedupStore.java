package com.newsrelay.service.store;

import com.newsrelay.core.model.Article;
import com.newsrelay.core.model.DedupRecord;

import java.util.List;

/**
 * The single record of articles already delivered. Records are added only by
 * {@link #commit(Article)} and removed only by size-bound eviction, oldest
 * {@code firstSeenAt} first.
 */
public interface DedupStore {
    boolean contains(String articleId);

    /**
     * @return {@code false} when the article was already recorded
     */
    boolean commit(Article article);

    int size();

    int maxSize();

    List<DedupRecord> records();

    void flush();
}
