package com.newsrelay.service.format;

import com.newsrelay.core.model.Article;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Renders an article as channel text. Translation failures fall back to the original
 * text.
 */
public class MessageFormatter {
    private static final Logger LOGGER = Logger.getLogger(MessageFormatter.class.getName());

    private final Translator translator;

    public MessageFormatter(Translator translator) {
        this.translator = translator;
    }

    public FormattedMessage format(Article article) {
        StringBuilder text = new StringBuilder();
        text.append(sectionEmoji(article.section())).append(' ').append(translated(article.title(), "headline"));
        if (article.hasSummary()) {
            text.append("\n\n").append(translated(article.summary(), "news summary"));
        }
        text.append("\n\n").append(article.link());
        return new FormattedMessage(text.toString(), article.hasImage() ? article.imageUrl() : null);
    }

    private String translated(String text, String hint) {
        try {
            String result = translator.translate(text, hint);
            return result == null || result.isBlank() ? text : result;
        } catch (RuntimeException e) {
            LOGGER.warning("Translation failed, sending original " + hint + ": " + e.getMessage());
            return text;
        }
    }

    static String sectionEmoji(String section) {
        String upper = section == null ? "" : section.toUpperCase(Locale.ROOT);
        if (upper.contains("CRYPTO")) {
            return "₿";
        }
        if (upper.contains("FOREX")) {
            return "💱";
        }
        if (upper.contains("STOCK")) {
            return "📈";
        }
        if (upper.contains("ECONOMIC")) {
            return "📊";
        }
        if (upper.contains("COMMODITIES")) {
            return "🛢";
        }
        if (upper.contains("EARNINGS")) {
            return "💰";
        }
        return "🚨";
    }
}
