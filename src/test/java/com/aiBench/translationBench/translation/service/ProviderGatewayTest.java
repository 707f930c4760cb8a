package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.translation.exception.ProviderException;
import com.aiBench.translationBench.translation.model.ProviderConfig;
import com.aiBench.translationBench.translation.model.ProviderOutcome;
import com.aiBench.translationBench.translation.model.ProviderTranslation;
import com.aiBench.translationBench.translation.model.ProviderType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ProviderGateway Tests")
class ProviderGatewayTest {

    private TranslationProviderFactory providerFactory;
    private ProviderGateway providerGateway;

    /**
     * Released after each test so that providers left hanging can finish.
     */
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        providerFactory = mock(TranslationProviderFactory.class);
        providerGateway = new ProviderGateway(providerFactory);
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
    }

    private static ProviderConfig config(String model) {
        return ProviderConfig.builder().type(ProviderType.OPENAI).model(model).build();
    }

    private ProviderConfig register(String model, long delayMs, String output) {
        ProviderConfig config = config(model);
        when(providerFactory.create(same(config), any(Duration.class)))
                .thenReturn(new StubProvider(model, () -> {
                    Thread.sleep(delayMs);
                    return output;
                }));
        return config;
    }

    @Test
    @DisplayName("Should return outcomes in request order regardless of completion order")
    void testDispatch_PreservesOrder() {
        List<ProviderConfig> configs = List.of(
                register("slow", 300, "uno"),
                register("fast", 10, "dos"),
                register("medium", 100, "tres"));

        List<ProviderOutcome> outcomes = providerGateway.dispatch("one", "es", "en", configs, Duration.ofSeconds(5));

        assertEquals(3, outcomes.size());
        assertEquals(List.of(0, 1, 2), outcomes.stream().map(ProviderOutcome::getIndex).toList());
        assertEquals(List.of("uno", "dos", "tres"), outcomes.stream().map(ProviderOutcome::getOutputText).toList());
        assertEquals("OPENAI - slow", outcomes.get(0).getProviderName());
        assertTrue(outcomes.stream().allMatch(ProviderOutcome::isSuccess));
    }

    @Test
    @DisplayName("Should run providers concurrently")
    void testDispatch_Concurrent() {
        List<ProviderConfig> configs = List.of(
                register("a", 400, "a"),
                register("b", 400, "b"),
                register("c", 400, "c"));

        long start = System.currentTimeMillis();
        providerGateway.dispatch("text", "es", null, configs, Duration.ofSeconds(5));

        assertTrue(System.currentTimeMillis() - start < 1100);
    }

    @Test
    @DisplayName("Should time out a hanging provider without affecting the others")
    void testDispatch_TimeoutIsolation() {
        ProviderConfig hanging = config("hanging");
        when(providerFactory.create(same(hanging), any(Duration.class)))
                .thenReturn(new StubProvider("hanging", () -> {
                    release.await(10, TimeUnit.SECONDS);
                    return "too late";
                }));
        List<ProviderConfig> configs = List.of(register("quick", 10, "hola"), hanging);

        long start = System.currentTimeMillis();
        List<ProviderOutcome> outcomes = providerGateway.dispatch("hello", "es", "en", configs, Duration.ofMillis(300));

        assertTrue(System.currentTimeMillis() - start < 3000);
        assertTrue(outcomes.get(0).isSuccess());
        assertEquals("hola", outcomes.get(0).getOutputText());
        assertFalse(outcomes.get(1).isSuccess());
        assertEquals("Provider timed out after 300ms", outcomes.get(1).getError());
        assertNull(outcomes.get(1).getOutputText());
    }

    @Test
    @DisplayName("Should record a failure when the adapter cannot be created")
    void testDispatch_CreationFailure() {
        ProviderConfig missingKey = ProviderConfig.builder().type(ProviderType.DEEPL).build();
        when(providerFactory.create(same(missingKey), any(Duration.class)))
                .thenThrow(new IllegalArgumentException("API key required for DeepL provider: DEEPL - deepl"));
        List<ProviderConfig> configs = List.of(missingKey, register("ok", 10, "bonjour"));

        List<ProviderOutcome> outcomes = providerGateway.dispatch("hello", "fr", null, configs, Duration.ofSeconds(5));

        assertEquals("API key required for DeepL provider: DEEPL - deepl", outcomes.get(0).getError());
        assertEquals(ProviderType.DEEPL, outcomes.get(0).getProviderType());
        assertEquals("deepl", outcomes.get(0).getModelId());
        assertTrue(outcomes.get(1).isSuccess());
    }

    @Test
    @DisplayName("Should record a failure when the backend call throws")
    void testDispatch_ProviderError() {
        ProviderConfig failing = config("failing");
        when(providerFactory.create(same(failing), any(Duration.class)))
                .thenReturn(new StubProvider("failing", () -> {
                    throw new ProviderException("Chat completions call failed: 500 Internal Server Error");
                }));

        List<ProviderOutcome> outcomes = providerGateway.dispatch("hello", "es", null, List.of(failing),
                Duration.ofSeconds(5));

        assertEquals(1, outcomes.size());
        assertFalse(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(0).getError().contains("500"));
    }

    @Test
    @DisplayName("Should return nothing for no providers")
    void testDispatch_Empty() {
        assertTrue(providerGateway.dispatch("hello", "es", null, List.of(), Duration.ofSeconds(5)).isEmpty());
    }

    private interface Body {
        String run() throws Exception;
    }

    private static class StubProvider implements TranslationProvider {

        private final String model;
        private final Body body;

        StubProvider(String model, Body body) {
            this.model = model;
            this.body = body;
        }

        @Override
        public String getName() {
            return "OPENAI - " + model;
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
        public ProviderTranslation translate(String text, String targetLang, String sourceLang) {
            try {
                return ProviderTranslation.builder().outputText(body.run()).build();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException("interrupted", e);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new ProviderException(e.getMessage(), e);
            }
        }
    }
}
