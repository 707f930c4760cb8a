package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricScore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Detects degenerate output that loops over the same phrase.
 *
 * For every word n-gram order from 2 up to the configured maximum, the repetition
 * ratio is {@code 1 - unique/total}, raised to {@code maxCount/total} when some n-gram
 * occurs more than once. The score is {@code (1 - worst ratio) * 100}.
 */
public class RepetitionMetric implements QualityMetric {

    private static final int MIN_ORDER = 2;

    private final double threshold;
    private final int maxOrder;

    public RepetitionMetric(double threshold, int maxOrder) {
        if (maxOrder < MIN_ORDER) {
            throw new IllegalArgumentException("Maximum n-gram order must be at least " + MIN_ORDER);
        }
        this.threshold = threshold;
        this.maxOrder = maxOrder;
    }

    @Override
    public String getName() {
        return MetricNames.REPETITION;
    }

    @Override
    public MetricScore evaluate(EvaluationInput input) {
        List<String> tokens = tokenize(input.getTranslatedText());

        Map<String, Object> perOrder = new LinkedHashMap<>();
        double worst = 0.0;
        for (int n = MIN_ORDER; n <= maxOrder; n++) {
            if (tokens.size() < n) {
                break;
            }
            double ratio = repetitionRatio(tokens, n);
            perOrder.put(String.valueOf(n), ratio);
            worst = Math.max(worst, ratio);
        }

        double score = (1.0 - worst) * 100.0;
        MetricScore.MetricScoreBuilder result = MetricScore.builder()
                .score(score)
                .detail("repetition_ratio", worst)
                .detail("ngram_repetition", perOrder);
        if (worst > threshold) {
            result.warning(String.format(Locale.ROOT,
                    "High repetition detected in translation (score: %.1f)", score));
        }
        return result.build();
    }

    private static double repetitionRatio(List<String> tokens, int n) {
        Map<String, Integer> counts = new HashMap<>();
        int total = tokens.size() - n + 1;
        for (int i = 0; i < total; i++) {
            counts.merge(String.join(" ", tokens.subList(i, i + n)), 1, Integer::sum);
        }
        double ratio = 1.0 - (double) counts.size() / total;
        int maxCount = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        if (maxCount > 1) {
            ratio = Math.max(ratio, (double) maxCount / total);
        }
        return ratio;
    }

    private static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return new ArrayList<>(Arrays.asList(text.toLowerCase(Locale.ROOT).trim().split("\\s+")));
    }
}
