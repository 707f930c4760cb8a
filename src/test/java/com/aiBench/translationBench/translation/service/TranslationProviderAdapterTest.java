package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.translation.exception.ProviderException;
import com.aiBench.translationBench.translation.model.ProviderTranslation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("Translation Provider Adapter Tests")
class TranslationProviderAdapterTest {

    private static final String COMPLETION = """
            {
              "id": "chatcmpl-1",
              "model": "gpt-4o-mini",
              "choices": [{"index": 0, "message": {"role": "assistant", "content": "  Hola mundo \\n"}}],
              "usage": {"prompt_tokens": 40, "completion_tokens": 4, "total_tokens": 44}
            }
            """;

    // ========== OpenAI-compatible ==========

    @Test
    @DisplayName("Should post a chat completion and strip the answer")
    void testOpenAi_Translate() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.openai.com/v1");
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        server.expect(requestTo("https://api.openai.com/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.temperature").value(0.3))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value("Translate to Spanish:\n\nHello world"))
                .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));
        OpenAiTranslationProvider provider = new OpenAiTranslationProvider(
                new ChatCompletionsClient(builder.build(), "sk-test"), "OPENAI - gpt-4o-mini", "gpt-4o-mini", 0.3);

        ProviderTranslation translation = provider.translate("Hello world", "es", "en");

        assertEquals("Hola mundo", translation.getOutputText());
        assertEquals(44, translation.getUsageTokens());
        server.verify();
    }

    @Test
    @DisplayName("Should wrap HTTP errors in ProviderException")
    void testOpenAi_ServerError() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.openai.com/v1");
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        server.expect(requestTo("https://api.openai.com/v1/chat/completions"))
                .andRespond(withServerError());
        OpenAiTranslationProvider provider = new OpenAiTranslationProvider(
                new ChatCompletionsClient(builder.build(), "sk-test"), "OPENAI - gpt-4o-mini", "gpt-4o-mini", 0.3);

        ProviderException e = assertThrows(ProviderException.class, () -> provider.translate("Hello", "es", null));

        assertTrue(e.getMessage().startsWith("Chat completions call failed"));
    }

    @Test
    @DisplayName("Should reject an empty completion")
    void testOpenAi_EmptyContent() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.openai.com/v1");
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        server.expect(requestTo("https://api.openai.com/v1/chat/completions"))
                .andRespond(withSuccess("{\"choices\": [{\"message\": {\"content\": \"  \"}}]}",
                        MediaType.APPLICATION_JSON));
        OpenAiTranslationProvider provider = new OpenAiTranslationProvider(
                new ChatCompletionsClient(builder.build(), "sk-test"), "OPENAI - gpt-4o-mini", "gpt-4o-mini", 0.3);

        assertThrows(ProviderException.class, () -> provider.translate("Hello", "es", null));
    }

    @Test
    @DisplayName("Should auto-detect the model of a local server")
    void testLocal_AutoDetectModel() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://localhost:1234/v1");
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        server.expect(requestTo("http://localhost:1234/v1/models"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"data\": [{\"id\": \"llama-3-8b\"}, {\"id\": \"qwen\"}]}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://localhost:1234/v1/chat/completions"))
                .andExpect(jsonPath("$.model").value("llama-3-8b"))
                .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));
        LocalOpenAiTranslationProvider provider = new LocalOpenAiTranslationProvider(
                new ChatCompletionsClient(builder.build(), null), "LOCAL_OPENAI - local-model", null, 0.3);

        ProviderTranslation translation = provider.translate("Hello world", "es", null);

        assertEquals("llama-3-8b", translation.getModel());
        assertEquals("llama-3-8b", provider.getModel());
        server.verify();
    }

    @Test
    @DisplayName("Should keep the placeholder when the model list is unavailable")
    void testLocal_ModelListFails() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://localhost:1234/v1");
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        server.expect(requestTo("http://localhost:1234/v1/models"))
                .andRespond(withServerError());
        server.expect(requestTo("http://localhost:1234/v1/chat/completions"))
                .andExpect(jsonPath("$.model").value("local-model"))
                .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));
        LocalOpenAiTranslationProvider provider = new LocalOpenAiTranslationProvider(
                new ChatCompletionsClient(builder.build(), null), "LOCAL_OPENAI - local-model", "local-model", 0.3);

        assertEquals("Hola mundo", provider.translate("Hello world", "es", null).getOutputText());
        server.verify();
    }

    // ========== DeepL ==========

    @Test
    @DisplayName("Should call DeepL with upper-case language codes")
    void testDeepL_Translate() {
        RestClient.Builder builder = RestClient.builder().baseUrl(DeepLTranslationProvider.FREE_API_URL);
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        server.expect(requestTo("https://api-free.deepl.com/v2/translate"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "DeepL-Auth-Key key:fx"))
                .andExpect(jsonPath("$.text[0]").value("Hello"))
                .andExpect(jsonPath("$.target_lang").value("PT-PT"))
                .andExpect(jsonPath("$.source_lang").value("EN"))
                .andRespond(withSuccess(
                        "{\"translations\": [{\"detected_source_language\": \"EN\", \"text\": \"Olá\"}]}",
                        MediaType.APPLICATION_JSON));
        DeepLTranslationProvider provider = new DeepLTranslationProvider(builder.build(), "key:fx", "DEEPL - deepl", "deepl");

        assertEquals("Olá", provider.translate("Hello", "pt", "en").getOutputText());
        server.verify();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "pt, PT-PT",
            "pt-BR, PT-PT",
            "de, DE",
            "en-us, EN-US",
            "zh_hans, ZH-HANS"
    })
    @DisplayName("Should map target codes to DeepL codes")
    void testDeepL_TargetCode(String code, String expected) {
        assertEquals(expected, DeepLTranslationProvider.toTargetCode(code));
    }

    @Test
    @DisplayName("Should pick the free endpoint for free-tier keys")
    void testDeepL_DefaultBaseUrl() {
        assertEquals(DeepLTranslationProvider.FREE_API_URL, DeepLTranslationProvider.defaultBaseUrl("abc:fx"));
        assertEquals(DeepLTranslationProvider.PRO_API_URL, DeepLTranslationProvider.defaultBaseUrl("abc"));
        assertNull(DeepLTranslationProvider.toSourceCode(null));
    }

    // ========== Google ==========

    @Test
    @DisplayName("Should call Google Translate with the key as query parameter")
    void testGoogle_Translate() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://translation.googleapis.com");
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        server.expect(requestTo("https://translation.googleapis.com/language/translate/v2?key=abc"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.q").value("Hello"))
                .andExpect(jsonPath("$.target").value("de"))
                .andExpect(jsonPath("$.format").value("text"))
                .andRespond(withSuccess("{\"data\": {\"translations\": [{\"translatedText\": \"Hallo\"}]}}",
                        MediaType.APPLICATION_JSON));
        GoogleTranslationProvider provider = new GoogleTranslationProvider(
                builder.build(), "abc", "GOOGLE_TRANSLATE - default", GoogleTranslationProvider.DEFAULT_MODEL);

        assertEquals("Hallo", provider.translate("Hello", "de", null).getOutputText());
        server.verify();
    }
}
