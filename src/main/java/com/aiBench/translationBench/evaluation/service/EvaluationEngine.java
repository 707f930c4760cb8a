package com.aiBench.translationBench.evaluation.service;

import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricEvaluation;
import com.aiBench.translationBench.evaluation.model.ScoreBreakdown;
import com.aiBench.translationBench.translation.model.ProviderOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Evaluation Engine service.
 *
 * Responsibilities:
 * - Score each successful provider outcome through the metric registry
 * - Fuse metric results into a ScoreBreakdown
 * - Evaluate different outcomes of a run concurrently on the evaluation executor
 */
@Slf4j
@Service
public class EvaluationEngine {

    private final MetricRegistry metricRegistry;
    private final ScoreFuser scoreFuser;
    private final ExecutorService evaluationExecutor;

    public EvaluationEngine(MetricRegistry metricRegistry,
                            ScoreFuser scoreFuser,
                            @Qualifier("evaluationExecutor") ExecutorService evaluationExecutor) {
        this.metricRegistry = metricRegistry;
        this.scoreFuser = scoreFuser;
        this.evaluationExecutor = evaluationExecutor;
    }

    /**
     * Evaluates a single translation.
     */
    public ScoreBreakdown evaluate(EvaluationInput input) {
        long start = System.currentTimeMillis();
        MetricEvaluation evaluation = metricRegistry.evaluate(input);
        ScoreBreakdown breakdown = scoreFuser.fuse(evaluation);
        log.debug("Evaluation completed - metrics: {}, failed: {}, overallScore: {}, latency: {}ms",
                evaluation.results().size(), evaluation.failedMetrics().size(),
                breakdown.getOverallScore(), System.currentTimeMillis() - start);
        return breakdown;
    }

    /**
     * Evaluates every successful outcome of a run.
     *
     * @return one entry per outcome, in the same order; null for failed outcomes
     */
    public List<ScoreBreakdown> evaluateAll(List<ProviderOutcome> outcomes,
                                            String sourceText,
                                            String targetLang,
                                            String sourceLang,
                                            String referenceTranslation) {
        List<CompletableFuture<ScoreBreakdown>> futures = new ArrayList<>(outcomes.size());
        for (ProviderOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                futures.add(CompletableFuture.completedFuture(null));
                continue;
            }
            EvaluationInput input = EvaluationInput.builder()
                    .sourceText(sourceText)
                    .translatedText(outcome.getOutputText())
                    .targetLang(targetLang)
                    .sourceLang(sourceLang)
                    .referenceTranslation(referenceTranslation)
                    .build();
            futures.add(CompletableFuture.supplyAsync(() -> evaluate(input), evaluationExecutor)
                    .exceptionally(ex -> {
                        log.error("Evaluation failed - provider: {}, error: {}",
                                outcome.getProviderName(), ex.getMessage(), ex);
                        Set<String> warnings = new LinkedHashSet<>();
                        warnings.add("Evaluation error: " + ex.getMessage());
                        return scoreFuser.failed(List.of(), warnings);
                    }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<ScoreBreakdown> breakdowns = new ArrayList<>(futures.size());
        futures.forEach(f -> breakdowns.add(f.join()));
        return breakdowns;
    }

    public MetricRegistry getMetricRegistry() {
        return metricRegistry;
    }
}
