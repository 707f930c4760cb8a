package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricScore;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * chrF against the reference: character n-grams 1..6, averaged precision and recall,
 * combined with beta = 2 so recall weighs more.
 */
public class ChrfMetric extends ReferenceBasedMetric {

    private static final int N = 6;
    private static final double BETA2 = 4.0;

    @Override
    public String getName() {
        return MetricNames.CHRF;
    }

    @Override
    public MetricScore evaluate(EvaluationInput input) {
        int[] reference = normalize(input.getReferenceTranslation());
        int[] hypothesis = normalize(input.getTranslatedText());

        double precisionSum = 0.0;
        double recallSum = 0.0;
        for (int n = 1; n <= N; n++) {
            Map<String, Integer> referenceCounts = ngrams(reference, n);
            Map<String, Integer> hypothesisCounts = ngrams(hypothesis, n);
            int overlap = 0;
            int hypothesisTotal = 0;
            for (Map.Entry<String, Integer> entry : hypothesisCounts.entrySet()) {
                hypothesisTotal += entry.getValue();
                overlap += Math.min(entry.getValue(), referenceCounts.getOrDefault(entry.getKey(), 0));
            }
            int referenceTotal = referenceCounts.values().stream().mapToInt(Integer::intValue).sum();
            precisionSum += hypothesisTotal == 0 ? 0.0 : (double) overlap / hypothesisTotal;
            recallSum += referenceTotal == 0 ? 0.0 : (double) overlap / referenceTotal;
        }

        double precision = precisionSum / N;
        double recall = recallSum / N;
        double f = precision + recall == 0.0
                ? 0.0
                : (1 + BETA2) * precision * recall / (recall + BETA2 * precision);
        return MetricScore.builder()
                .score(f * 100.0)
                .detail("char_precision", precision)
                .detail("char_recall", recall)
                .build();
    }

    private static int[] normalize(String text) {
        if (text == null) {
            return new int[0];
        }
        return text.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT).codePoints().toArray();
    }

    private static Map<String, Integer> ngrams(int[] codePoints, int n) {
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i + n <= codePoints.length; i++) {
            counts.merge(new String(codePoints, i, n), 1, Integer::sum);
        }
        return counts;
    }
}
