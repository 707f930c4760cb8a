package com.aiBench.translationBench.evaluation.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Raw output of a single metric: a score in [0,100], its sub-scores and the
 * threshold breaches it noticed.
 */
@Value
@Builder
public class MetricScore {

    double score;

    @Singular
    Map<String, Object> details;

    @Singular
    List<String> warnings;

    public static MetricScore of(double score) {
        return MetricScore.builder().score(score).build();
    }
}
