package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.translation.model.ProviderTranslation;
import com.aiBench.translationBench.translation.model.ProviderType;

/**
 * Single capability every translation backend offers.
 * Implementations are thin HTTP adapters; they throw on any failure and leave
 * timing, timeout and isolation to the gateway.
 */
public interface TranslationProvider {

    /**
     * Display name, e.g. "OPENAI - gpt-4o-mini".
     */
    String getName();

    ProviderType getType();

    String getModel();

    /**
     * Translates the text.
     *
     * @param text       Source text
     * @param targetLang Target language code
     * @param sourceLang Source language code, or null to let the backend detect it
     * @return the translation
     * @throws RuntimeException if the backend fails or answers with nothing usable
     */
    ProviderTranslation translate(String text, String targetLang, String sourceLang);
}
