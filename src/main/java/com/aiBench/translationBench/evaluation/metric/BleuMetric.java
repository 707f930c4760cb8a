package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricScore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentence-level BLEU-4 against the reference.
 * Modified n-gram precision with add-one smoothing for orders above 1, geometric mean,
 * brevity penalty.
 */
public class BleuMetric extends ReferenceBasedMetric {

    private static final int MAX_ORDER = 4;

    private static final Pattern TOKEN_PATTERN = Pattern.compile("[\\p{L}\\p{M}\\p{N}]+|[^\\s\\p{L}\\p{M}\\p{N}]");

    @Override
    public String getName() {
        return MetricNames.BLEU;
    }

    @Override
    public MetricScore evaluate(EvaluationInput input) {
        List<String> hypothesis = tokenize(input.getTranslatedText());
        List<String> reference = tokenize(input.getReferenceTranslation());
        if (hypothesis.isEmpty() || reference.isEmpty()) {
            return MetricScore.builder().score(0.0).detail("brevity_penalty", 0.0).build();
        }

        List<Double> precisions = new ArrayList<>();
        double logSum = 0.0;
        for (int n = 1; n <= MAX_ORDER; n++) {
            Map<List<String>, Integer> hypothesisCounts = ngrams(hypothesis, n);
            Map<List<String>, Integer> referenceCounts = ngrams(reference, n);
            int matches = 0;
            int total = 0;
            for (Map.Entry<List<String>, Integer> entry : hypothesisCounts.entrySet()) {
                total += entry.getValue();
                matches += Math.min(entry.getValue(), referenceCounts.getOrDefault(entry.getKey(), 0));
            }
            double precision = n == 1
                    ? (total == 0 ? 0.0 : (double) matches / total)
                    : (matches + 1.0) / (total + 1.0);
            precisions.add(precision);
            if (precision == 0.0) {
                return MetricScore.builder()
                        .score(0.0)
                        .detail("precisions", precisions)
                        .detail("brevity_penalty", brevityPenalty(hypothesis.size(), reference.size()))
                        .build();
            }
            logSum += Math.log(precision);
        }

        double brevityPenalty = brevityPenalty(hypothesis.size(), reference.size());
        double bleu = brevityPenalty * Math.exp(logSum / MAX_ORDER);
        return MetricScore.builder()
                .score(Math.min(100.0, bleu * 100.0))
                .detail("precisions", precisions)
                .detail("brevity_penalty", brevityPenalty)
                .build();
    }

    private static double brevityPenalty(int hypothesisLength, int referenceLength) {
        if (hypothesisLength >= referenceLength) {
            return 1.0;
        }
        return Math.exp(1.0 - (double) referenceLength / hypothesisLength);
    }

    private static Map<List<String>, Integer> ngrams(List<String> tokens, int n) {
        Map<List<String>, Integer> counts = new HashMap<>();
        for (int i = 0; i + n <= tokens.size(); i++) {
            counts.merge(List.copyOf(tokens.subList(i, i + n)), 1, Integer::sum);
        }
        return counts;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = TOKEN_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
