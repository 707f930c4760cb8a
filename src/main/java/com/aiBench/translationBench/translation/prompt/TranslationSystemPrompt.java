package com.aiBench.translationBench.translation.prompt;

/**
 * Prompts for translating with a chat-completions model.
 *
 * The target language is spelled out by name and repeated, since smaller local
 * models otherwise tend to answer in the source language.
 */
public class TranslationSystemPrompt {

    private static final String UNKNOWN_SOURCE = "the source language";

    /**
     * Returns the system prompt for translating into the given language.
     *
     * @param sourceLang Source language code, or null for auto-detection
     * @param targetLang Target language code
     * @return System prompt string
     */
    public static String getSystemPrompt(String sourceLang, String targetLang) {
        String source = sourceLang == null || sourceLang.isBlank() ? UNKNOWN_SOURCE : LanguageNames.nameOf(sourceLang);
        String target = LanguageNames.nameOf(targetLang);
        return """
            You are a professional translator. Your task is to translate the following text from %1$s to %2$s.

            IMPORTANT: You MUST translate to %2$s. Do not answer in any other language.

            Guidelines:
            - Preserve the original meaning, tone and formatting
            - Maintain numbers, dates and named entities exactly as written
            - Return ONLY the translation
            - Do not add explanations, notes or commentary
            """.formatted(source, target);
    }

    /**
     * Returns the user message carrying the text to translate.
     */
    public static String getUserMessage(String text, String targetLang) {
        return "Translate to " + LanguageNames.nameOf(targetLang) + ":\n\n" + text;
    }
}
