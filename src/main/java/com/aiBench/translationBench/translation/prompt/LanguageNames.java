package com.aiBench.translationBench.translation.prompt;

import com.aiBench.translationBench.language.model.LanguageDetectionResult;

import java.util.Map;

/**
 * English display names for the language codes the benchmark commonly sees.
 */
public final class LanguageNames {

    private static final Map<String, String> NAMES = Map.ofEntries(
            Map.entry("en", "English"),
            Map.entry("es", "Spanish"),
            Map.entry("fr", "French"),
            Map.entry("de", "German"),
            Map.entry("it", "Italian"),
            Map.entry("pt", "Portuguese"),
            Map.entry("zh", "Chinese"),
            Map.entry("ja", "Japanese"),
            Map.entry("ko", "Korean"),
            Map.entry("ru", "Russian"),
            Map.entry("ar", "Arabic"),
            Map.entry("hi", "Hindi"),
            Map.entry("hu", "Hungarian"),
            Map.entry("vi", "Vietnamese"),
            Map.entry("th", "Thai"),
            Map.entry("he", "Hebrew")
    );

    private LanguageNames() {
    }

    /**
     * Returns the English name for a code, or the code itself when unknown.
     */
    public static String nameOf(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return NAMES.getOrDefault(LanguageDetectionResult.primarySubtag(code), code);
    }
}
