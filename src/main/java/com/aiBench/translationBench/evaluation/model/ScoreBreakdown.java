package com.aiBench.translationBench.evaluation.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Fused quality assessment of one successful translation.
 * When no metric could be applied, {@code evaluationFailed} is set and
 * {@code overallScore} is null rather than a fabricated zero.
 */
@Value
@Builder
@Jacksonized
public class ScoreBreakdown {

    Double overallScore;

    boolean evaluationFailed;

    /**
     * Applied metrics in registry order.
     */
    List<MetricResult> metrics;

    /**
     * Deduplicated, in the order they were raised.
     */
    List<String> warnings;

    String explanation;

    QualityLabel qualityLabel;

    public boolean hasScore() {
        return !evaluationFailed && overallScore != null;
    }
}
