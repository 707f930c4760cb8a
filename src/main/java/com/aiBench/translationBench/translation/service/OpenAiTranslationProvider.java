package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.translation.model.ProviderType;

/**
 * OpenAI cloud chat models.
 */
public class OpenAiTranslationProvider extends ChatCompletionsTranslationProvider {

    private final String model;

    public OpenAiTranslationProvider(ChatCompletionsClient client, String name, String model, double temperature) {
        super(client, name, temperature);
        this.model = model;
    }

    @Override
    public ProviderType getType() {
        return ProviderType.OPENAI;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    protected String resolveModel() {
        return model;
    }
}
