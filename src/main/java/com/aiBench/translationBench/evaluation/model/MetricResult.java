package com.aiBench.translationBench.evaluation.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * A metric score as it entered fusion, together with the weight it was given.
 */
@Value
@Builder
@Jacksonized
public class MetricResult {

    String name;

    double score;

    double weight;

    Map<String, Object> details;

    List<String> warnings;
}
