package com.newsrelay.core.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HtmlUtils {
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
    private static final Pattern IMG_SRC_PATTERN = Pattern.compile(
            "<img[^>]+src\\s*=\\s*(['\"])(.*?)\\1",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private HtmlUtils() {
    }

    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE_PATTERN.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Cuts {@code text} to {@code maxLength} chars and appends "..." when anything was removed.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength).trim() + "...";
    }

    public static Optional<String> firstImageSource(String html) {
        if (html == null || html.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = IMG_SRC_PATTERN.matcher(html);
        while (matcher.find()) {
            String src = matcher.group(2).trim();
            if (!src.isEmpty() && isAllowedLink(src)) {
                return Optional.of(src);
            }
        }
        return Optional.empty();
    }

    public static boolean isAllowedLink(String link) {
        String lowered = link.toLowerCase(Locale.ROOT);
        return !lowered.startsWith("mailto:") && !lowered.startsWith("javascript:") && !lowered.startsWith("data:");
    }
}
