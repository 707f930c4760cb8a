package com.aiBench.translationBench.language.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Map;

/**
 * Result of language detection.
 * Carries the best-matching language and the per-language evidence behind it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LanguageDetectionResult {

    public static final String UNDETERMINED = "und";

    /**
     * Legacy or macro-language codes and the code detection reports for them.
     */
    private static final Map<String, String> CODE_ALIASES = Map.of(
            "no", "nb",
            "iw", "he",
            "in", "id");

    /**
     * Detected ISO 639-1 language code, or "und" when no language could be determined.
     */
    private String languageCode;

    /**
     * Confidence score (0.0 to 1.0) indicating detection confidence.
     */
    private double confidence;

    /**
     * Raw evidence per candidate language (script share or profile hits).
     */
    private Map<String, Double> scores;

    public static LanguageDetectionResult undetermined() {
        return LanguageDetectionResult.builder()
                .languageCode(UNDETERMINED)
                .confidence(0.0)
                .scores(Map.of())
                .build();
    }

    public boolean isDetermined() {
        return languageCode != null && !UNDETERMINED.equals(languageCode);
    }

    /**
     * Compares on the primary subtag, so "pt-BR" matches "pt" and "no" matches "nb".
     */
    public boolean matches(String expectedCode) {
        if (!isDetermined() || expectedCode == null) {
            return false;
        }
        return canonicalCode(languageCode).equals(canonicalCode(expectedCode));
    }

    public static String canonicalCode(String code) {
        String primary = primarySubtag(code);
        return CODE_ALIASES.getOrDefault(primary, primary);
    }

    public static String primarySubtag(String code) {
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        int dash = normalized.indexOf('-');
        return dash > 0 ? normalized.substring(0, dash) : normalized;
    }
}
