package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricScore;

/**
 * A single quality signal computed from a translation.
 *
 * Implementations must be pure: they may hold immutable configuration and read-only
 * collaborators, but no state that changes between evaluations. The registry calls
 * them concurrently for different provider outputs.
 */
public interface QualityMetric {

    /**
     * Stable snake_case name, used as the key in breakdowns and persisted evaluations.
     */
    String getName();

    /**
     * Whether the metric takes part in fusion for this input. Inapplicable metrics
     * are left out entirely, not scored zero.
     */
    default boolean isApplicable(EvaluationInput input) {
        return true;
    }

    /**
     * Scores the translation in [0,100].
     *
     * @throws RuntimeException if the metric cannot be computed; the registry excludes it
     */
    MetricScore evaluate(EvaluationInput input);
}
