package com.aiBench.translationBench.evaluation.metric;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public final class MetricNames {

    public static final String LANGUAGE_MATCH = "language_match";
    public static final String LENGTH_RATIO = "length_ratio";
    public static final String REPETITION = "repetition";
    public static final String PRESERVATION = "preservation";
    public static final String SEMANTIC_SIMILARITY = "semantic_similarity";
    public static final String BLEU = "bleu";
    public static final String CHRF = "chrf";
    public static final String REFERENCE_SIMILARITY = "reference_similarity";

    /**
     * Name of the persisted evaluation that carries the fused score.
     */
    public static final String OVERALL_SCORE = "overall_score";

    private MetricNames() {
    }

    /**
     * "semantic_similarity" becomes "Semantic Similarity".
     */
    public static String displayName(String metricName) {
        return Arrays.stream(metricName.split("_"))
                .filter(part -> !part.isEmpty())
                .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1))
                .collect(Collectors.joining(" "));
    }

    /**
     * Configuration key of a metric under {@code benchmark.metrics}: "semantic_similarity" becomes "semantic-similarity".
     */
    public static String propertyKey(String metricName) {
        return metricName.replace('_', '-');
    }
}
