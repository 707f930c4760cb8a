package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricScore;

import java.util.Locale;

/**
 * Compares translation length to source length in code points.
 * The score peaks at a ratio of 1.0, stays in [50,100] inside the acceptable band
 * and falls below 50 outside it.
 */
public class LengthRatioMetric implements QualityMetric {

    private final double minRatio;
    private final double maxRatio;

    public LengthRatioMetric(double minRatio, double maxRatio) {
        if (minRatio <= 0 || minRatio >= 1.0 || maxRatio <= 1.0) {
            throw new IllegalArgumentException(
                    "Length ratio band must satisfy 0 < min < 1 < max, got [" + minRatio + ", " + maxRatio + "]");
        }
        this.minRatio = minRatio;
        this.maxRatio = maxRatio;
    }

    @Override
    public String getName() {
        return MetricNames.LENGTH_RATIO;
    }

    @Override
    public MetricScore evaluate(EvaluationInput input) {
        String source = input.getSourceText();
        String translated = input.getTranslatedText() == null ? "" : input.getTranslatedText();
        int sourceLength = source.codePointCount(0, source.length());
        int translatedLength = translated.codePointCount(0, translated.length());

        if (sourceLength == 0) {
            throw new IllegalArgumentException("Source text is empty");
        }
        if (translatedLength == 0) {
            return MetricScore.builder()
                    .score(0.0)
                    .detail("ratio", 0.0)
                    .warning("Empty translation")
                    .build();
        }

        double ratio = (double) translatedLength / sourceLength;
        MetricScore.MetricScoreBuilder result = MetricScore.builder()
                .detail("ratio", ratio)
                .detail("source_length", sourceLength)
                .detail("translation_length", translatedLength);

        if (ratio >= minRatio && ratio <= maxRatio) {
            double score = ratio < 1.0
                    ? (ratio - minRatio) / (1.0 - minRatio) * 100.0
                    : (maxRatio - ratio) / (maxRatio - 1.0) * 100.0;
            return result.score(Math.max(50.0, score)).build();
        }

        boolean tooShort = ratio < minRatio;
        double score = tooShort ? ratio / minRatio * 50.0 : maxRatio / ratio * 50.0;
        return result.score(Math.max(0.0, Math.min(50.0, score)))
                .warning(String.format(Locale.ROOT,
                        "Unusual length ratio detected: translation too %s (ratio: %.2f)",
                        tooShort ? "short" : "long", ratio))
                .build();
    }
}
