package com.newsrelay.service.config;

import java.nio.file.Path;

public record StoreSettings(String file, int maxRecords) {
    public static final int DEFAULT_MAX_RECORDS = 3000;

    public StoreSettings {
        file = file == null || file.isBlank() ? "data/seen_articles.json" : file;
        maxRecords = maxRecords <= 0 ? DEFAULT_MAX_RECORDS : maxRecords;
    }

    public static StoreSettings defaults() {
        return new StoreSettings(null, 0);
    }

    public Path path() {
        return Path.of(file);
    }

    public StoreSettings withFile(String override) {
        return new StoreSettings(override, maxRecords);
    }
}
