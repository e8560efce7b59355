package com.newsrelay.service.format;

public class NoopTranslator implements Translator {
    @Override
    public String translate(String text, String contextHint) {
        return text;
    }
}
