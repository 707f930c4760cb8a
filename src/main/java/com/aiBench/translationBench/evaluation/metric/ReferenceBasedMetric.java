package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.model.EvaluationInput;

/**
 * Base for metrics that compare the translation against a gold reference.
 * They only apply when the request supplied one.
 */
public abstract class ReferenceBasedMetric implements QualityMetric {

    @Override
    public final boolean isApplicable(EvaluationInput input) {
        return input.hasReference();
    }
}
