package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.translation.dto.ChatCompletionResponse;
import com.aiBench.translationBench.translation.exception.ProviderException;
import com.aiBench.translationBench.translation.model.ProviderTranslation;
import com.aiBench.translationBench.translation.prompt.TranslationSystemPrompt;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates by prompting a chat-completions model.
 */
@Slf4j
public abstract class ChatCompletionsTranslationProvider implements TranslationProvider {

    protected final ChatCompletionsClient client;
    private final String name;
    private final double temperature;

    protected ChatCompletionsTranslationProvider(ChatCompletionsClient client, String name, double temperature) {
        this.client = client;
        this.name = name;
        this.temperature = temperature;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Model to put in the request. Subclasses may resolve it lazily.
     */
    protected abstract String resolveModel();

    @Override
    public ProviderTranslation translate(String text, String targetLang, String sourceLang) {
        String model = resolveModel();
        ChatCompletionResponse response = client.complete(
                TranslationSystemPrompt.getSystemPrompt(sourceLang, targetLang),
                TranslationSystemPrompt.getUserMessage(text, targetLang),
                model,
                temperature);

        String content = response.getContent();
        if (content == null || content.isBlank()) {
            throw new ProviderException("Provider returned an empty translation");
        }

        log.debug("Translation received - provider: {}, output length: {}", name, content.length());
        return ProviderTranslation.builder()
                .outputText(content.strip())
                .usageTokens(response.getTotalTokens())
                .model(model)
                .build();
    }
}
