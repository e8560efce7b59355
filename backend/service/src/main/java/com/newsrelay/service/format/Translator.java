package com.newsrelay.service.format;

public interface Translator {
    /**
     * @param contextHint short description of what the text is, e.g. "headline"
     * @throws TranslationException when the text could not be translated
     */
    String translate(String text, String contextHint);
}
