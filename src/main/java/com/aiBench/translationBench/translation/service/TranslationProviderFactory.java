package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.config.BenchmarkProperties;
import com.aiBench.translationBench.translation.model.ProviderConfig;
import com.aiBench.translationBench.translation.model.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Creates translation provider adapters from request configurations.
 *
 * Credentials and endpoints missing from a request fall back to the configured
 * defaults under {@code benchmark.provider}. Adding a backend means adding a
 * {@link ProviderType} and a branch here; the orchestrator is untouched.
 */
@Slf4j
@Component
public class TranslationProviderFactory {

    private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final BenchmarkProperties.Provider settings;

    public TranslationProviderFactory(BenchmarkProperties properties) {
        this.settings = properties.getProvider();
    }

    /**
     * Model used when a request leaves it blank.
     */
    public static String defaultModel(ProviderType type) {
        switch (type) {
            case OPENAI:
                return "gpt-4o-mini";
            case LOCAL_OPENAI:
                return LocalOpenAiTranslationProvider.PLACEHOLDER_MODEL;
            case DEEPL:
                return "deepl";
            case GOOGLE_TRANSLATE:
                return GoogleTranslationProvider.DEFAULT_MODEL;
            default:
                throw new IllegalArgumentException("Unsupported provider type: " + type);
        }
    }

    public static String modelOf(ProviderConfig config) {
        if (config.getModel() != null && !config.getModel().isBlank()) {
            return config.getModel();
        }
        return config.getType() != null ? defaultModel(config.getType()) : "unknown";
    }

    /**
     * "OPENAI - gpt-4o-mini" style display name.
     */
    public static String displayName(ProviderConfig config) {
        String type = config.getType() != null ? config.getType().name() : "UNKNOWN";
        return type + " - " + modelOf(config);
    }

    /**
     * Creates the adapter for one provider configuration.
     *
     * @param config  Provider configuration from the request
     * @param timeout Per-call timeout, applied as HTTP read timeout
     * @return the adapter
     * @throws IllegalArgumentException if the type is unsupported or a required credential or URL is missing
     */
    public TranslationProvider create(ProviderConfig config, Duration timeout) {
        if (config == null || config.getType() == null) {
            throw new IllegalArgumentException("Provider type is required");
        }
        String name = displayName(config);
        String model = modelOf(config);
        log.info("Creating provider - name: {}, type: {}", name, config.getType().getCode());

        switch (config.getType()) {
            case OPENAI: {
                String apiKey = firstNonBlank(config.getApiKey(), settings.getOpenaiApiKey());
                if (apiKey == null) {
                    throw new IllegalArgumentException("API key required for OpenAI provider: " + name);
                }
                String baseUrl = firstNonBlank(config.getBaseUrl(), settings.getOpenaiBaseUrl());
                return new OpenAiTranslationProvider(
                        new ChatCompletionsClient(restClient(baseUrl, timeout), apiKey),
                        name, model, settings.getTemperature());
            }
            case LOCAL_OPENAI: {
                if (isBlank(config.getBaseUrl())) {
                    throw new IllegalArgumentException("base_url required for local_openai provider: " + name);
                }
                return new LocalOpenAiTranslationProvider(
                        new ChatCompletionsClient(restClient(config.getBaseUrl(), timeout), config.getApiKey()),
                        name, model, settings.getTemperature());
            }
            case DEEPL: {
                String apiKey = firstNonBlank(config.getApiKey(), settings.getDeeplApiKey());
                if (apiKey == null) {
                    throw new IllegalArgumentException("API key required for DeepL provider: " + name);
                }
                String baseUrl = firstNonBlank(config.getBaseUrl(), settings.getDeeplBaseUrl());
                if (baseUrl == null) {
                    baseUrl = DeepLTranslationProvider.defaultBaseUrl(apiKey);
                }
                return new DeepLTranslationProvider(restClient(baseUrl, timeout), apiKey, name, model);
            }
            case GOOGLE_TRANSLATE: {
                String apiKey = firstNonBlank(config.getApiKey(), settings.getGoogleApiKey());
                if (apiKey == null) {
                    throw new IllegalArgumentException("API key required for Google Translate provider: " + name);
                }
                String baseUrl = firstNonBlank(config.getBaseUrl(), settings.getGoogleBaseUrl());
                return new GoogleTranslationProvider(restClient(baseUrl, timeout), apiKey, name, model);
            }
            default:
                throw new IllegalArgumentException("Unsupported provider type: " + config.getType());
        }
    }

    private static RestClient restClient(String baseUrl, Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout.compareTo(MAX_CONNECT_TIMEOUT) < 0 ? timeout : MAX_CONNECT_TIMEOUT);
        requestFactory.setReadTimeout(timeout);
        return RestClient.builder()
                .baseUrl(stripTrailingSlash(baseUrl))
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (!isBlank(preferred)) {
            return preferred;
        }
        return isBlank(fallback) ? null : fallback;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
