package com.aiBench.translationBench.translation.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Settled result of one provider call within a run.
 * Exactly one of {@code outputText} and {@code error} is set.
 */
@Value
@Builder
@Jacksonized
public class ProviderOutcome {

    /**
     * Position of the provider in the request.
     */
    int index;

    String providerName;

    ProviderType providerType;

    String modelId;

    String outputText;

    long latencyMs;

    Integer usageTokens;

    String error;

    public boolean isSuccess() {
        return error == null;
    }

    public static ProviderOutcome success(int index, String providerName, ProviderType providerType,
                                          String modelId, ProviderTranslation translation, long latencyMs) {
        return ProviderOutcome.builder()
                .index(index)
                .providerName(providerName)
                .providerType(providerType)
                .modelId(modelId)
                .outputText(translation.getOutputText() == null ? "" : translation.getOutputText())
                .usageTokens(translation.getUsageTokens())
                .latencyMs(latencyMs)
                .build();
    }

    public static ProviderOutcome failure(int index, String providerName, ProviderType providerType,
                                          String modelId, String error, long latencyMs) {
        return ProviderOutcome.builder()
                .index(index)
                .providerName(providerName)
                .providerType(providerType)
                .modelId(modelId)
                .error(error == null || error.isBlank() ? "Unknown error" : error)
                .latencyMs(latencyMs)
                .build();
    }
}
