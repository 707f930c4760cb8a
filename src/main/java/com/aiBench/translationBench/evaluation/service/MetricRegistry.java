package com.aiBench.translationBench.evaluation.service;

import com.aiBench.translationBench.config.BenchmarkProperties;
import com.aiBench.translationBench.evaluation.embedding.TextEmbedder;
import com.aiBench.translationBench.evaluation.metric.BleuMetric;
import com.aiBench.translationBench.evaluation.metric.ChrfMetric;
import com.aiBench.translationBench.evaluation.metric.LanguageMatchMetric;
import com.aiBench.translationBench.evaluation.metric.LengthRatioMetric;
import com.aiBench.translationBench.evaluation.metric.MetricNames;
import com.aiBench.translationBench.evaluation.metric.PreservationMetric;
import com.aiBench.translationBench.evaluation.metric.QualityMetric;
import com.aiBench.translationBench.evaluation.metric.ReferenceSimilarityMetric;
import com.aiBench.translationBench.evaluation.metric.RepetitionMetric;
import com.aiBench.translationBench.evaluation.metric.SemanticSimilarityMetric;
import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricEvaluation;
import com.aiBench.translationBench.evaluation.model.MetricResult;
import com.aiBench.translationBench.evaluation.model.MetricScore;
import com.aiBench.translationBench.language.service.LanguageDetector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of enabled metrics with their fusion weights.
 *
 * Responsibilities:
 * - Skip metrics that are not applicable to an input (e.g. reference metrics without a reference)
 * - Isolate failures: a metric that throws or yields a non-finite score is dropped for that input only
 * - Keep results in registry order
 */
@Slf4j
public class MetricRegistry {

    /**
     * Registry order and default weights.
     */
    public static final Map<String, Double> DEFAULT_WEIGHTS;

    static {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(MetricNames.LANGUAGE_MATCH, 0.15);
        weights.put(MetricNames.LENGTH_RATIO, 0.10);
        weights.put(MetricNames.REPETITION, 0.10);
        weights.put(MetricNames.PRESERVATION, 0.15);
        weights.put(MetricNames.SEMANTIC_SIMILARITY, 0.50);
        weights.put(MetricNames.BLEU, 0.20);
        weights.put(MetricNames.CHRF, 0.20);
        weights.put(MetricNames.REFERENCE_SIMILARITY, 0.20);
        DEFAULT_WEIGHTS = Collections.unmodifiableMap(weights);
    }

    private final List<RegisteredMetric> metrics;

    public MetricRegistry(List<RegisteredMetric> metrics) {
        this.metrics = List.copyOf(metrics);
    }

    /**
     * Builds the registry from {@code benchmark.metrics} and {@code benchmark.thresholds}.
     * A metric is registered unless it is disabled or its weight is not positive.
     */
    public static MetricRegistry fromProperties(BenchmarkProperties properties,
                                                LanguageDetector languageDetector,
                                                TextEmbedder embedder) {
        BenchmarkProperties.Thresholds thresholds = properties.getThresholds();
        List<RegisteredMetric> registered = new ArrayList<>();
        for (Map.Entry<String, Double> entry : DEFAULT_WEIGHTS.entrySet()) {
            String name = entry.getKey();
            BenchmarkProperties.MetricSettings settings = properties.getMetrics().get(MetricNames.propertyKey(name));
            boolean enabled = settings == null || settings.getEnabled() == null || settings.getEnabled();
            double weight = settings != null && settings.getWeight() != null ? settings.getWeight() : entry.getValue();
            if (!enabled || weight <= 0) {
                log.info("Metric disabled - metric: {}, enabled: {}, weight: {}", name, enabled, weight);
                continue;
            }
            registered.add(new RegisteredMetric(createMetric(name, thresholds, languageDetector, embedder), weight));
        }
        log.info("Metric registry initialized - metrics: {}",
                registered.stream().map(m -> m.name() + "=" + m.weight()).toList());
        return new MetricRegistry(registered);
    }

    private static QualityMetric createMetric(String name,
                                              BenchmarkProperties.Thresholds thresholds,
                                              LanguageDetector languageDetector,
                                              TextEmbedder embedder) {
        switch (name) {
            case MetricNames.LANGUAGE_MATCH:
                return new LanguageMatchMetric(languageDetector, thresholds.getLanguageConfidenceFloor());
            case MetricNames.LENGTH_RATIO:
                return new LengthRatioMetric(thresholds.getLengthRatioMin(), thresholds.getLengthRatioMax());
            case MetricNames.REPETITION:
                return new RepetitionMetric(thresholds.getRepetitionThreshold(), thresholds.getMaxNgramSize());
            case MetricNames.PRESERVATION:
                return new PreservationMetric(thresholds.isCheckNumbers(), thresholds.isCheckPunctuation(),
                        thresholds.isCheckEntities());
            case MetricNames.SEMANTIC_SIMILARITY:
                return new SemanticSimilarityMetric(embedder);
            case MetricNames.BLEU:
                return new BleuMetric();
            case MetricNames.CHRF:
                return new ChrfMetric();
            case MetricNames.REFERENCE_SIMILARITY:
                return new ReferenceSimilarityMetric(embedder);
            default:
                throw new IllegalArgumentException("Unknown metric: " + name);
        }
    }

    public List<RegisteredMetric> getMetrics() {
        return metrics;
    }

    /**
     * Weights of the registered metrics, in registry order.
     */
    public Map<String, Double> weights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        metrics.forEach(m -> weights.put(m.name(), m.weight()));
        return weights;
    }

    /**
     * Runs every applicable metric against the input, sequentially and in registry order.
     *
     * @param input The texts to score
     * @return results of the metrics that succeeded, and names of those that failed
     */
    public MetricEvaluation evaluate(EvaluationInput input) {
        List<MetricResult> results = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (RegisteredMetric registeredMetric : metrics) {
            QualityMetric metric = registeredMetric.metric();
            if (!metric.isApplicable(input)) {
                log.debug("Metric not applicable - metric: {}", metric.getName());
                continue;
            }
            try {
                MetricScore score = metric.evaluate(input);
                if (score == null || Double.isNaN(score.getScore()) || Double.isInfinite(score.getScore())) {
                    log.warn("Metric returned an undefined score - metric: {}", metric.getName());
                    failed.add(metric.getName());
                    continue;
                }
                results.add(MetricResult.builder()
                        .name(metric.getName())
                        .score(Math.max(0.0, Math.min(100.0, score.getScore())))
                        .weight(registeredMetric.weight())
                        .details(score.getDetails())
                        .warnings(score.getWarnings())
                        .build());
            } catch (RuntimeException e) {
                log.warn("Metric evaluation failed - metric: {}, error: {}", metric.getName(), e.getMessage(), e);
                failed.add(metric.getName());
            }
        }

        return new MetricEvaluation(List.copyOf(results), List.copyOf(failed));
    }
}
