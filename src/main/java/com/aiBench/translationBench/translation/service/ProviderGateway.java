package com.aiBench.translationBench.translation.service;

import com.aiBench.translationBench.config.ExecutorConfig;
import com.aiBench.translationBench.translation.model.ProviderConfig;
import com.aiBench.translationBench.translation.model.ProviderOutcome;
import com.aiBench.translationBench.translation.model.ProviderTranslation;
import com.aiBench.translationBench.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Provider Gateway service - concurrent fan-out of one text to many translation backends.
 *
 * Responsibilities:
 * - Run one task per provider, all in flight at once
 * - Bound every call by its own timeout
 * - Turn any failure (adapter creation, transport, vendor error, timeout) into a failure outcome
 * - Wait for every outcome and return them in request order
 *
 * Timed-out calls are not interrupted; they drain in the background and their result is dropped.
 */
@Slf4j
@Service
public class ProviderGateway {

    private final TranslationProviderFactory providerFactory;

    public ProviderGateway(TranslationProviderFactory providerFactory) {
        this.providerFactory = providerFactory;
    }

    /**
     * Dispatches the text to every configured provider concurrently.
     *
     * @param text       Source text
     * @param targetLang Target language code
     * @param sourceLang Source language code, or null for auto-detection
     * @param configs    Providers, in request order
     * @param timeout    Per-call timeout
     * @return one outcome per config, in the same order
     */
    public List<ProviderOutcome> dispatch(String text, String targetLang, String sourceLang,
                                          List<ProviderConfig> configs, Duration timeout) {
        if (configs.isEmpty()) {
            return List.of();
        }
        long startTime = System.currentTimeMillis();
        log.info("Dispatching to providers - count: {}, targetLang: {}, timeout: {}ms",
                configs.size(), targetLang, timeout.toMillis());

        ExecutorService executor = MdcPropagation.wrapExecutor(
                Executors.newFixedThreadPool(configs.size(), ExecutorConfig.daemonThreadFactory("provider-")));
        try {
            List<CompletableFuture<ProviderOutcome>> futures = new ArrayList<>(configs.size());
            for (int i = 0; i < configs.size(); i++) {
                int index = i;
                ProviderConfig config = configs.get(i);
                long submittedAt = System.currentTimeMillis();
                futures.add(CompletableFuture
                        .supplyAsync(() -> callProvider(index, config, text, targetLang, sourceLang, timeout), executor)
                        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(ex -> failureFromException(index, config, ex, timeout,
                                System.currentTimeMillis() - submittedAt)));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<ProviderOutcome> outcomes = new ArrayList<>(configs.size());
            futures.forEach(f -> outcomes.add(f.join()));

            long succeeded = outcomes.stream().filter(ProviderOutcome::isSuccess).count();
            log.info("Dispatch completed - succeeded: {}, failed: {}, latency: {}ms",
                    succeeded, outcomes.size() - succeeded, System.currentTimeMillis() - startTime);
            return outcomes;
        } finally {
            // no interrupt: calls still in flight are left to drain
            executor.shutdown();
        }
    }

    private ProviderOutcome callProvider(int index, ProviderConfig config, String text,
                                         String targetLang, String sourceLang, Duration timeout) {
        String name = TranslationProviderFactory.displayName(config);
        String model = TranslationProviderFactory.modelOf(config);
        long start = System.currentTimeMillis();
        try {
            TranslationProvider provider = providerFactory.create(config, timeout);
            ProviderTranslation translation = provider.translate(text, targetLang, sourceLang);
            long latencyMs = System.currentTimeMillis() - start;
            String modelId = translation.getModel() != null ? translation.getModel() : provider.getModel();
            log.info("Provider call succeeded - provider: {}, latency: {}ms, tokens: {}",
                    provider.getName(), latencyMs, translation.getUsageTokens());
            return ProviderOutcome.success(index, provider.getName(), provider.getType(), modelId,
                    translation, latencyMs);
        } catch (RuntimeException e) {
            long latencyMs = System.currentTimeMillis() - start;
            log.warn("Provider call failed - provider: {}, latency: {}ms, error: {}", name, latencyMs, e.getMessage());
            return ProviderOutcome.failure(index, name, config.getType(), model, e.getMessage(), latencyMs);
        }
    }

    private ProviderOutcome failureFromException(int index, ProviderConfig config, Throwable ex,
                                                 Duration timeout, long latencyMs) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        String name = TranslationProviderFactory.displayName(config);
        String error;
        if (cause instanceof TimeoutException) {
            error = "Provider timed out after " + timeout.toMillis() + "ms";
            log.warn("Provider call timed out - provider: {}, timeout: {}ms", name, timeout.toMillis());
        } else {
            error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            log.error("Provider call failed unexpectedly - provider: {}, error: {}", name, error, cause);
        }
        return ProviderOutcome.failure(index, name, config.getType(), TranslationProviderFactory.modelOf(config),
                error, latencyMs);
    }
}
