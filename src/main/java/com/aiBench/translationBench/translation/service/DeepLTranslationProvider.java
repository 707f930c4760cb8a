package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.language.model.LanguageDetectionResult;
import com.aiBench.translationBench.translation.dto.DeepLTranslateRequest;
import com.aiBench.translationBench.translation.dto.DeepLTranslateResponse;
import com.aiBench.translationBench.translation.exception.ProviderException;
import com.aiBench.translationBench.translation.model.ProviderTranslation;
import com.aiBench.translationBench.translation.model.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Locale;

/**
 * DeepL REST API ({@code POST /v2/translate}).
 */
@Slf4j
public class DeepLTranslationProvider implements TranslationProvider {

    public static final String FREE_API_URL = "https://api-free.deepl.com";
    public static final String PRO_API_URL = "https://api.deepl.com";

    private final RestClient restClient;
    private final String apiKey;
    private final String name;
    private final String model;

    public DeepLTranslationProvider(RestClient restClient, String apiKey, String name, String model) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.name = name;
        this.model = model;
    }

    /**
     * Free-tier keys end in ":fx" and must use the free endpoint.
     */
    public static String defaultBaseUrl(String apiKey) {
        return apiKey != null && apiKey.endsWith(":fx") ? FREE_API_URL : PRO_API_URL;
    }

    /**
     * DeepL wants upper-case codes and a regional variant for Portuguese targets.
     */
    static String toTargetCode(String languageCode) {
        String primary = LanguageDetectionResult.primarySubtag(languageCode);
        if ("pt".equals(primary)) {
            return "PT-PT";
        }
        return languageCode.trim().toUpperCase(Locale.ROOT).replace('_', '-');
    }

    static String toSourceCode(String languageCode) {
        if (languageCode == null || languageCode.isBlank()) {
            return null;
        }
        return LanguageDetectionResult.primarySubtag(languageCode).toUpperCase(Locale.ROOT);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ProviderType getType() {
        return ProviderType.DEEPL;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public ProviderTranslation translate(String text, String targetLang, String sourceLang) {
        DeepLTranslateRequest request = DeepLTranslateRequest.builder()
                .text(List.of(text))
                .targetLang(toTargetCode(targetLang))
                .sourceLang(toSourceCode(sourceLang))
                .build();
        try {
            log.debug("Calling DeepL - target: {}, text length: {}", request.getTargetLang(), text.length());
            DeepLTranslateResponse response = restClient.post()
                    .uri("/v2/translate")
                    .header(HttpHeaders.AUTHORIZATION, "DeepL-Auth-Key " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(DeepLTranslateResponse.class);

            String output = response != null ? response.getTranslatedText() : null;
            if (output == null || output.isBlank()) {
                throw new ProviderException("DeepL returned an empty translation");
            }
            return ProviderTranslation.builder()
                    .outputText(output.strip())
                    .model(model)
                    .build();
        } catch (RestClientException e) {
            throw new ProviderException("DeepL call failed: " + e.getMessage(), e);
        }
    }
}
