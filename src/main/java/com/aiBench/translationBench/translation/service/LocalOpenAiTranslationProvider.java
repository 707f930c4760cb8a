package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.translation.model.ProviderType;
import lombok.extern.slf4j.Slf4j;

/**
 * Local OpenAI-compatible server such as LM Studio or Ollama.
 *
 * When no concrete model is configured ("local-model" or blank), the first model
 * listed by the server is used. Failing to list models is not fatal; the
 * placeholder is sent and the server picks its loaded model.
 */
@Slf4j
public class LocalOpenAiTranslationProvider extends ChatCompletionsTranslationProvider {

    public static final String PLACEHOLDER_MODEL = "local-model";

    private final String configuredModel;

    private volatile String resolvedModel;

    public LocalOpenAiTranslationProvider(ChatCompletionsClient client, String name, String model, double temperature) {
        super(client, name, temperature);
        this.configuredModel = model == null || model.isBlank() ? PLACEHOLDER_MODEL : model;
    }

    @Override
    public ProviderType getType() {
        return ProviderType.LOCAL_OPENAI;
    }

    @Override
    public String getModel() {
        return resolvedModel != null ? resolvedModel : configuredModel;
    }

    @Override
    protected String resolveModel() {
        if (resolvedModel != null) {
            return resolvedModel;
        }
        String model = configuredModel;
        if (PLACEHOLDER_MODEL.equals(configuredModel)) {
            try {
                String detected = client.listModels().firstModelId();
                if (detected != null && !detected.isBlank()) {
                    log.info("Local model auto-detected - provider: {}, model: {}", getName(), detected);
                    model = detected;
                } else {
                    log.warn("Local server lists no models - provider: {}", getName());
                }
            } catch (RuntimeException e) {
                log.warn("Local model auto-detection failed - provider: {}, error: {}", getName(), e.getMessage());
            }
        }
        resolvedModel = model;
        return model;
    }
}
