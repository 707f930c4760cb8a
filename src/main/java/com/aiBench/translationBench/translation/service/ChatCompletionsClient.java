package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.translation.dto.ChatCompletionRequest;
import com.aiBench.translationBench.translation.dto.ChatCompletionResponse;
import com.aiBench.translationBench.translation.dto.ModelListResponse;
import com.aiBench.translationBench.translation.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Client for OpenAI-compatible servers (OpenAI itself, LM Studio, Ollama, vLLM...).
 * Handles HTTP communication with the chat completions and models endpoints.
 */
@Slf4j
public class ChatCompletionsClient {

    private final RestClient restClient;
    private final String apiKey;

    /**
     * @param restClient RestClient with the server's base URL (e.g. "https://api.openai.com/v1")
     * @param apiKey     Bearer token, or null for servers without authentication
     */
    public ChatCompletionsClient(RestClient restClient, String apiKey) {
        this.restClient = restClient;
        this.apiKey = apiKey;
    }

    /**
     * Calls the chat completions endpoint with a system prompt and a user message.
     *
     * @param systemPrompt System prompt for the task
     * @param userMessage  User message to process
     * @param model        Model to use
     * @param temperature  Sampling temperature
     * @return ChatCompletionResponse with the result
     * @throws ProviderException if the API call fails
     */
    public ChatCompletionResponse complete(String systemPrompt, String userMessage, String model, double temperature) {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .messages(List.of(
                        ChatCompletionRequest.Message.builder()
                                .role("system")
                                .content(systemPrompt)
                                .build(),
                        ChatCompletionRequest.Message.builder()
                                .role("user")
                                .content(userMessage)
                                .build()
                ))
                .model(model)
                .temperature(temperature)
                .stream(false)
                .build();

        try {
            log.debug("Calling chat completions - model: {}, message length: {}", model, userMessage.length());

            ChatCompletionResponse response = restClient.post()
                    .uri("/chat/completions")
                    .headers(this::authorize)
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionResponse.class);

            if (response == null) {
                throw new ProviderException("Chat completions returned null response");
            }

            log.debug("Chat completions response received - model: {}, tokens used: {}",
                    response.getModel(),
                    response.getTotalTokens() != null ? response.getTotalTokens() : "unknown");

            return response;

        } catch (RestClientException e) {
            throw new ProviderException("Chat completions call failed: " + e.getMessage(), e);
        }
    }

    /**
     * Lists the models the server offers.
     *
     * @throws ProviderException if the call fails
     */
    public ModelListResponse listModels() {
        try {
            ModelListResponse response = restClient.get()
                    .uri("/models")
                    .headers(this::authorize)
                    .retrieve()
                    .body(ModelListResponse.class);
            if (response == null) {
                throw new ProviderException("Models endpoint returned null response");
            }
            return response;
        } catch (RestClientException e) {
            throw new ProviderException("Models call failed: " + e.getMessage(), e);
        }
    }

    private void authorize(HttpHeaders headers) {
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
    }
}
