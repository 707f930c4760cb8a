package com.aiBench.translationBench.evaluation.service;

import com.aiBench.translationBench.evaluation.model.MetricResult;
import com.aiBench.translationBench.evaluation.model.QualityLabel;
import com.aiBench.translationBench.evaluation.model.ScoreBreakdown;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScoreFuser Tests")
class ScoreFuserTest {

    private final ScoreFuser scoreFuser = new ScoreFuser();

    private static MetricResult result(String name, double score, double weight, String... warnings) {
        return MetricResult.builder()
                .name(name)
                .score(score)
                .weight(weight)
                .details(Map.of())
                .warnings(List.of(warnings))
                .build();
    }

    @Test
    @DisplayName("Should compute the weighted average of applied metrics")
    void testFuse_WeightedAverage() {
        ScoreBreakdown breakdown = scoreFuser.fuse(
                List.of(result("alpha_metric", 80.0, 0.5), result("beta_metric", 60.0, 0.5)), List.of());

        assertEquals(70.0, breakdown.getOverallScore());
        assertFalse(breakdown.isEvaluationFailed());
        assertTrue(breakdown.hasScore());
        assertEquals(QualityLabel.FAIR, breakdown.getQualityLabel());
        assertEquals("Fair translation quality (score: 70.0/100). Top factors: Alpha Metric, Beta Metric.",
                breakdown.getExplanation());
        assertTrue(breakdown.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("Should renormalize over the metrics that were applied")
    void testFuse_RenormalizedWeights() {
        ScoreBreakdown breakdown = scoreFuser.fuse(
                List.of(result("language_match", 100.0, 0.15), result("semantic_similarity", 90.0, 0.5)),
                List.of());

        assertEquals((100.0 * 0.15 + 90.0 * 0.5) / 0.65, breakdown.getOverallScore(), 1e-9);
        assertEquals(QualityLabel.EXCELLENT, breakdown.getQualityLabel());
    }

    @Test
    @DisplayName("Should mark the evaluation failed when nothing applied")
    void testFuse_NoApplicableMetrics() {
        ScoreBreakdown breakdown = scoreFuser.fuse(List.of(), List.of("semantic_similarity"));

        assertNull(breakdown.getOverallScore());
        assertTrue(breakdown.isEvaluationFailed());
        assertFalse(breakdown.hasScore());
        assertTrue(breakdown.getWarnings().contains("No applicable metrics"));
        assertTrue(breakdown.getWarnings().contains("semantic_similarity: evaluation failed"));
        assertEquals("Evaluation failed: no applicable metrics", breakdown.getExplanation());
    }

    @Test
    @DisplayName("Should warn when the overall score is poor")
    void testFuse_PoorQuality() {
        ScoreBreakdown breakdown = scoreFuser.fuse(List.of(result("repetition", 40.0, 0.1)), List.of());

        assertEquals(40.0, breakdown.getOverallScore(), 1e-9);
        assertEquals(QualityLabel.POOR, breakdown.getQualityLabel());
        assertTrue(breakdown.getWarnings().contains("Overall quality is poor"));
        assertTrue(breakdown.getExplanation().startsWith("Poor translation quality"));
    }

    @Test
    @DisplayName("Should prefix metric warnings and drop duplicates")
    void testFuse_Warnings() {
        ScoreBreakdown breakdown = scoreFuser.fuse(List.of(
                result("length_ratio", 90.0, 0.1, "too long", "too long"),
                result("preservation", 95.0, 0.1, "too long")), List.of("bleu"));

        assertEquals(List.of("length_ratio: too long", "preservation: too long", "bleu: evaluation failed"),
                breakdown.getWarnings());
    }

    @Test
    @DisplayName("Should name the three largest contributions as top factors")
    void testFuse_TopFactors() {
        ScoreBreakdown breakdown = scoreFuser.fuse(List.of(
                result("language_match", 100.0, 0.15),
                result("length_ratio", 100.0, 0.10),
                result("repetition", 100.0, 0.10),
                result("semantic_similarity", 80.0, 0.50)), List.of());

        assertTrue(breakdown.getExplanation()
                .endsWith("Top factors: Semantic Similarity, Language Match, Length Ratio."));
    }

    @Test
    @DisplayName("Should keep fused metrics in the order given")
    void testFuse_MetricOrder() {
        List<MetricResult> results = List.of(result("b", 50.0, 1.0), result("a", 70.0, 1.0));

        ScoreBreakdown breakdown = scoreFuser.fuse(results, List.of());

        assertEquals(results, breakdown.getMetrics());
    }
}
