package com.aiBench.translationBench.orchestrator.service;

import com.aiBench.translationBench.config.BenchmarkProperties;
import com.aiBench.translationBench.evaluation.metric.MetricNames;
import com.aiBench.translationBench.evaluation.model.MetricResult;
import com.aiBench.translationBench.evaluation.model.ScoreBreakdown;
import com.aiBench.translationBench.evaluation.service.EvaluationEngine;
import com.aiBench.translationBench.gateway.dto.TranslationRequest;
import com.aiBench.translationBench.gateway.exception.InvalidRequestException;
import com.aiBench.translationBench.gateway.exception.RunPersistenceException;
import com.aiBench.translationBench.language.model.LanguageDetectionResult;
import com.aiBench.translationBench.language.service.LanguageDetector;
import com.aiBench.translationBench.orchestrator.model.ProviderResult;
import com.aiBench.translationBench.orchestrator.model.Run;
import com.aiBench.translationBench.orchestrator.model.RunState;
import com.aiBench.translationBench.orchestrator.model.RunSummary;
import com.aiBench.translationBench.repository.RunRepository;
import com.aiBench.translationBench.translation.model.ProviderConfig;
import com.aiBench.translationBench.translation.model.ProviderOutcome;
import com.aiBench.translationBench.translation.service.ProviderGateway;
import com.aiBench.translationBench.util.MdcPropagation;
import com.aiBench.translationBench.util.TextHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Run Orchestrator service - drives one benchmark run from request to stored result.
 *
 * Flow:
 * 1. Validate the request (nothing is dispatched or stored for a rejected request)
 * 2. COLLECTING: fan the text out to every provider
 * 3. EVALUATING: score every successful translation
 * 4. RANKED: rank providers and build the summary
 * 5. PERSISTED: store run, translations and evaluations
 *
 * Provider and metric failures only degrade the affected provider. A storage failure
 * is reported with the computed run attached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunOrchestrator {

    private final ProviderGateway providerGateway;
    private final EvaluationEngine evaluationEngine;
    private final RankingService rankingService;
    private final RunRepository runRepository;
    private final LanguageDetector languageDetector;
    private final BenchmarkProperties properties;

    /**
     * Executes a benchmark run.
     *
     * @param request The run request
     * @return the persisted run
     * @throws InvalidRequestException if the request is rejected before dispatch
     * @throws RunPersistenceException if the computed run could not be stored
     */
    public Run execute(TranslationRequest request) {
        validate(request);

        String correlationId = UUID.randomUUID().toString();
        String previousCorrelationId = MDC.get(MdcPropagation.CORRELATION_ID);
        MDC.put(MdcPropagation.CORRELATION_ID, correlationId);
        try {
            return run(request, correlationId);
        } finally {
            if (previousCorrelationId != null) {
                MDC.put(MdcPropagation.CORRELATION_ID, previousCorrelationId);
            } else {
                MDC.remove(MdcPropagation.CORRELATION_ID);
            }
        }
    }

    private Run run(TranslationRequest request, String correlationId) {
        long startTime = System.currentTimeMillis();
        String sourceLang = blankToNull(request.getSourceLang());
        String reference = blankToNull(request.getReferenceTranslation());
        Duration timeout = request.getTimeout() != null
                ? Duration.ofSeconds(request.getTimeout())
                : properties.getProvider().getTimeout();

        RunState state = RunState.COLLECTING;
        log.info("Run started - correlationId: {}, providers: {}, targetLang: {}, sourceLang: {}, hasReference: {}",
                correlationId, request.getProviders().size(), request.getTargetLang(),
                sourceLang != null ? sourceLang : "auto", reference != null);

        List<ProviderOutcome> outcomes = providerGateway.dispatch(
                request.getText(), request.getTargetLang(), sourceLang, request.getProviders(), timeout);

        state = advance(state, RunState.EVALUATING, correlationId);
        String detectedSourceLang = sourceLang == null ? detectSourceLanguage(request.getText()) : null;
        List<ScoreBreakdown> breakdowns = evaluationEngine.evaluateAll(outcomes, request.getText(),
                request.getTargetLang(), sourceLang != null ? sourceLang : detectedSourceLang, reference);

        List<ProviderResult> results = new ArrayList<>(outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            results.add(ProviderResult.builder()
                    .outcome(outcomes.get(i))
                    .evaluation(breakdowns.get(i))
                    .build());
        }

        state = advance(state, RunState.RANKED, correlationId);
        RunSummary summary = rankingService.summarize(results);
        Run ranked = Run.builder()
                .state(state)
                .correlationId(correlationId)
                .sourceText(request.getText())
                .targetLang(request.getTargetLang())
                .sourceLang(sourceLang)
                .detectedSourceLang(detectedSourceLang)
                .referenceTranslation(reference)
                .textHash(TextHasher.sha256(request.getText()))
                .configSnapshot(configSnapshot(request, timeout))
                .results(List.copyOf(results))
                .summary(summary)
                .createdAt(Instant.now())
                .build();

        Run persisted = persist(ranked);
        advance(state, persisted.getState(), correlationId);

        log.info("Run completed - correlationId: {}, runId: {}, best: {}, bestScore: {}, latency: {}ms",
                correlationId, persisted.getId(), summary.getBestProvider(), summary.getBestScore(),
                System.currentTimeMillis() - startTime);
        return persisted;
    }

    private void validate(TranslationRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Request is required");
        }
        if (request.getProviders() == null || request.getProviders().isEmpty()) {
            throw new InvalidRequestException("At least one provider must be configured");
        }
        if (request.getProviders().stream().anyMatch(p -> p == null || p.getType() == null)) {
            throw new InvalidRequestException("Every provider needs a type");
        }
        String text = request.getText();
        if (text == null || text.isBlank()) {
            throw new InvalidRequestException("Text cannot be empty");
        }
        int length = text.codePointCount(0, text.length());
        if (length > properties.getMaxTextLength()) {
            throw new InvalidRequestException(String.format("Text exceeds maximum length of %d characters (got %d)",
                    properties.getMaxTextLength(), length));
        }
        if (request.getTargetLang() == null || request.getTargetLang().isBlank()) {
            throw new InvalidRequestException("Target language is required");
        }
    }

    private RunState advance(RunState current, RunState target, String correlationId) {
        if (current.next() != target) {
            throw new IllegalStateException("Illegal run transition " + current + " -> " + target);
        }
        log.debug("Run state changed - correlationId: {}, state: {}", correlationId, target);
        return target;
    }

    private Run persist(Run ranked) {
        try {
            Run stored = runRepository.createRun(ranked);
            for (ProviderResult result : ranked.getResults()) {
                String translationId = runRepository.createTranslation(stored.getId(), result.getOutcome());
                if (result.getEvaluation() != null) {
                    persistEvaluation(translationId, result.getEvaluation());
                }
            }
            return stored;
        } catch (RuntimeException e) {
            log.error("Run could not be saved - correlationId: {}, error: {}", ranked.getCorrelationId(), e.getMessage(), e);
            throw new RunPersistenceException("Run could not be saved: " + e.getMessage(), ranked, e);
        }
    }

    private void persistEvaluation(String translationId, ScoreBreakdown breakdown) {
        for (MetricResult metric : breakdown.getMetrics()) {
            Map<String, Object> details = new LinkedHashMap<>();
            if (metric.getDetails() != null) {
                details.putAll(metric.getDetails());
            }
            details.put("weight", metric.getWeight());
            details.put("warnings", metric.getWarnings());
            runRepository.createEvaluation(translationId, metric.getName(), metric.getScore(), details);
        }

        Map<String, Object> overallDetails = new LinkedHashMap<>();
        overallDetails.put("explanation", breakdown.getExplanation());
        overallDetails.put("warnings", breakdown.getWarnings());
        overallDetails.put("evaluation_failed", breakdown.isEvaluationFailed());
        overallDetails.put("quality_label", breakdown.getQualityLabel() != null ? breakdown.getQualityLabel().name() : null);
        runRepository.createEvaluation(translationId, MetricNames.OVERALL_SCORE, breakdown.getOverallScore(), overallDetails);
    }

    private Map<String, Object> configSnapshot(TranslationRequest request, Duration timeout) {
        List<Map<String, Object>> providers = new ArrayList<>();
        for (ProviderConfig config : request.getProviders()) {
            ProviderConfig safe = config.withoutCredentials();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", safe.getType().getCode());
            entry.put("model", safe.getModel());
            entry.put("base_url", safe.getBaseUrl());
            providers.add(entry);
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("providers", providers);
        snapshot.put("metric_weights", evaluationEngine.getMetricRegistry().weights());
        snapshot.put("timeout_ms", timeout.toMillis());
        return snapshot;
    }

    private String detectSourceLanguage(String text) {
        LanguageDetectionResult detection = languageDetector.detectLanguage(text);
        return detection.isDetermined() ? detection.getLanguageCode() : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
