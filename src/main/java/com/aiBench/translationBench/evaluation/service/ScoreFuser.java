package com.aiBench.translationBench.evaluation.service;

import com.aiBench.translationBench.evaluation.metric.MetricNames;
import com.aiBench.translationBench.evaluation.model.MetricEvaluation;
import com.aiBench.translationBench.evaluation.model.MetricResult;
import com.aiBench.translationBench.evaluation.model.QualityLabel;
import com.aiBench.translationBench.evaluation.model.ScoreBreakdown;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines metric results into one overall score.
 *
 * The overall score is the weighted average over the metrics that were applied,
 * so an excluded metric neither adds to the numerator nor dilutes the denominator.
 */
@Component
public class ScoreFuser {

    static final double POOR_THRESHOLD = 60.0;
    static final int TOP_FACTORS = 3;

    public ScoreBreakdown fuse(MetricEvaluation evaluation) {
        return fuse(evaluation.results(), evaluation.failedMetrics());
    }

    public ScoreBreakdown fuse(List<MetricResult> results, List<String> failedMetrics) {
        Set<String> warnings = new LinkedHashSet<>();
        for (MetricResult result : results) {
            if (result.getWarnings() != null) {
                result.getWarnings().forEach(w -> warnings.add(result.getName() + ": " + w));
            }
        }
        failedMetrics.forEach(name -> warnings.add(name + ": evaluation failed"));

        double totalWeight = results.stream().mapToDouble(MetricResult::getWeight).sum();
        if (results.isEmpty() || totalWeight <= 0) {
            warnings.add("No applicable metrics");
            return failed(results, warnings);
        }

        double weightedSum = results.stream().mapToDouble(r -> r.getScore() * r.getWeight()).sum();
        double overall = Math.max(0.0, Math.min(100.0, weightedSum / totalWeight));
        if (overall < POOR_THRESHOLD) {
            warnings.add("Overall quality is poor");
        }

        QualityLabel label = QualityLabel.fromScore(overall);
        return ScoreBreakdown.builder()
                .overallScore(overall)
                .evaluationFailed(false)
                .metrics(List.copyOf(results))
                .warnings(new ArrayList<>(warnings))
                .explanation(explain(label, overall, results))
                .qualityLabel(label)
                .build();
    }

    /**
     * Breakdown for an outcome that could not be scored at all.
     */
    public ScoreBreakdown failed(List<MetricResult> results, Set<String> warnings) {
        return ScoreBreakdown.builder()
                .overallScore(null)
                .evaluationFailed(true)
                .metrics(List.copyOf(results))
                .warnings(new ArrayList<>(warnings))
                .explanation("Evaluation failed: no applicable metrics")
                .build();
    }

    private static String explain(QualityLabel label, double overall, List<MetricResult> results) {
        // stable sort keeps registry order among equal contributions
        String topFactors = results.stream()
                .sorted(Comparator.comparingDouble((MetricResult r) -> r.getScore() * r.getWeight()).reversed())
                .limit(TOP_FACTORS)
                .map(r -> MetricNames.displayName(r.getName()))
                .collect(Collectors.joining(", "));
        return String.format(Locale.ROOT, "%s translation quality (score: %.1f/100). Top factors: %s.",
                label.getDisplayName(), overall, topFactors);
    }
}
