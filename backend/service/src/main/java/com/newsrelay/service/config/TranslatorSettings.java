package com.newsrelay.service.config;

import java.time.Duration;

public record TranslatorSettings(
        boolean enabled,
        String endpoint,
        String apiKey,
        String model,
        String targetLanguage,
        Duration timeout
) {
    public TranslatorSettings {
        endpoint = endpoint == null || endpoint.isBlank() ? "https://api.groq.com/openai/v1/chat/completions" : endpoint;
        model = model == null || model.isBlank() ? "llama-3.3-70b-versatile" : model;
        targetLanguage = targetLanguage == null || targetLanguage.isBlank() ? "Arabic" : targetLanguage;
        timeout = timeout == null ? Duration.ofSeconds(20) : timeout;
    }

    public static TranslatorSettings defaults() {
        return new TranslatorSettings(false, null, null, null, null, null);
    }

    public TranslatorSettings withOverrides(String overrideEndpoint, String overrideKey, String overrideModel) {
        return new TranslatorSettings(
                enabled,
                overrideEndpoint == null ? endpoint : overrideEndpoint,
                overrideKey == null ? apiKey : overrideKey,
                overrideModel == null ? model : overrideModel,
                targetLanguage,
                timeout
        );
    }
}
