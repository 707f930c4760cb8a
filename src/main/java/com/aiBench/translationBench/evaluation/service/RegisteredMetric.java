package com.aiBench.translationBench.evaluation.service;

import com.aiBench.translationBench.evaluation.metric.QualityMetric;

/**
 * A metric as registered for fusion, with the weight it contributes when applicable.
 */
public record RegisteredMetric(QualityMetric metric, double weight) {

    public RegisteredMetric {
        if (weight <= 0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Metric weight must be positive: " + metric.getName() + "=" + weight);
        }
    }

    public String name() {
        return metric.getName();
    }
}
