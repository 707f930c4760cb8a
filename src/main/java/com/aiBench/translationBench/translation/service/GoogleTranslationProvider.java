package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.translation.dto.GoogleTranslateRequest;
import com.aiBench.translationBench.translation.dto.GoogleTranslateResponse;
import com.aiBench.translationBench.translation.exception.ProviderException;
import com.aiBench.translationBench.translation.model.ProviderTranslation;
import com.aiBench.translationBench.translation.model.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Google Cloud Translation Basic (v2) REST API.
 */
@Slf4j
public class GoogleTranslationProvider implements TranslationProvider {

    public static final String DEFAULT_MODEL = "default";

    private final RestClient restClient;
    private final String apiKey;
    private final String name;
    private final String model;

    public GoogleTranslationProvider(RestClient restClient, String apiKey, String name, String model) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.name = name;
        this.model = model;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ProviderType getType() {
        return ProviderType.GOOGLE_TRANSLATE;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public ProviderTranslation translate(String text, String targetLang, String sourceLang) {
        GoogleTranslateRequest request = GoogleTranslateRequest.builder()
                .q(text)
                .target(targetLang)
                .source(sourceLang == null || sourceLang.isBlank() ? null : sourceLang)
                .format("text")
                .model(DEFAULT_MODEL.equals(model) ? null : model)
                .build();
        try {
            log.debug("Calling Google Translate - target: {}, text length: {}", targetLang, text.length());
            GoogleTranslateResponse response = restClient.post()
                    .uri(uri -> uri.path("/language/translate/v2").queryParam("key", apiKey).build())
                    .body(request)
                    .retrieve()
                    .body(GoogleTranslateResponse.class);

            String output = response != null ? response.getTranslatedText() : null;
            if (output == null || output.isBlank()) {
                throw new ProviderException("Google Translate returned an empty translation");
            }
            return ProviderTranslation.builder()
                    .outputText(output.strip())
                    .model(model)
                    .build();
        } catch (RestClientException e) {
            throw new ProviderException("Google Translate call failed: " + e.getMessage(), e);
        }
    }
}
