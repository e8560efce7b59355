package com.newsrelay.collectors.filter;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public record KeywordCategory(String name, int weight, List<String> keywords) {
    public KeywordCategory {
        Objects.requireNonNull(name, "name is required");
        keywords = keywords == null
                ? List.of()
                : keywords.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT).trim()).filter(k -> !k.isEmpty()).toList();
    }
}
