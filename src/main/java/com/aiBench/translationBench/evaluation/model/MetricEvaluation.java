package com.aiBench.translationBench.evaluation.model;

import java.util.List;

/**
 * What the registry produced for one input: results of the metrics that ran,
 * and the names of the applicable metrics that failed.
 */
public record MetricEvaluation(List<MetricResult> results, List<String> failedMetrics) {
}
