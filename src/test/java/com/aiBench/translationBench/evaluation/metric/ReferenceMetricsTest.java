package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricScore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reference-based Metric Tests")
class ReferenceMetricsTest {

    private final BleuMetric bleu = new BleuMetric();
    private final ChrfMetric chrf = new ChrfMetric();

    private static EvaluationInput input(String translated, String reference) {
        return EvaluationInput.builder()
                .sourceText("El gato se sentó en la alfombra")
                .translatedText(translated)
                .targetLang("en")
                .referenceTranslation(reference)
                .build();
    }

    // ========== Applicability ==========

    @Test
    @DisplayName("Should not apply without a reference translation")
    void testIsApplicable_NoReference() {
        EvaluationInput noReference = input("the cat sat on the mat", null);
        EvaluationInput blankReference = input("the cat sat on the mat", "  ");

        assertFalse(bleu.isApplicable(noReference));
        assertFalse(chrf.isApplicable(noReference));
        assertFalse(bleu.isApplicable(blankReference));
        assertTrue(bleu.isApplicable(input("the cat sat on the mat", "the cat sat on the mat")));
    }

    // ========== BLEU ==========

    @Test
    @DisplayName("Should score an exact match 100")
    void testBleu_ExactMatch() {
        MetricScore score = bleu.evaluate(input("The cat sat on the mat.", "the cat sat on the mat."));

        assertEquals(100.0, score.getScore(), 1e-9);
        assertEquals(1.0, (Double) score.getDetails().get("brevity_penalty"), 1e-9);
    }

    @Test
    @DisplayName("Should score a translation without shared words 0")
    void testBleu_NoOverlap() {
        MetricScore score = bleu.evaluate(input("dog runs fast", "the cat sat on the mat"));

        assertEquals(0.0, score.getScore(), 1e-9);
    }

    @Test
    @DisplayName("Should penalize a short but precise hypothesis")
    void testBleu_BrevityPenalty() {
        MetricScore score = bleu.evaluate(input("the cat sat", "the cat sat on the mat"));

        double penalty = (Double) score.getDetails().get("brevity_penalty");
        assertEquals(Math.exp(1.0 - 6.0 / 3.0), penalty, 1e-9);
        assertTrue(score.getScore() > 0.0 && score.getScore() < 50.0);
    }

    @Test
    @DisplayName("Should split punctuation into its own tokens")
    void testTokenize_Punctuation() {
        assertEquals(List.of("hello", ",", "world", "!"), BleuMetric.tokenize("Hello, world!"));
    }

    // ========== chrF ==========

    @Test
    @DisplayName("Should score identical strings 100")
    void testChrf_Identical() {
        MetricScore score = chrf.evaluate(input("Le chat est assis", "le chat  est assis"));

        assertEquals(100.0, score.getScore(), 1e-9);
    }

    @Test
    @DisplayName("Should score strings without shared characters 0")
    void testChrf_Disjoint() {
        assertEquals(0.0, chrf.evaluate(input("abc", "xyz")).getScore(), 1e-9);
    }

    @Test
    @DisplayName("Should give partial credit to a near miss")
    void testChrf_NearMiss() {
        MetricScore score = chrf.evaluate(input("the cats sat on a mat", "the cat sat on the mat"));

        assertTrue(score.getScore() > 50.0 && score.getScore() < 100.0);
        assertTrue(score.getDetails().containsKey("char_precision"));
        assertTrue(score.getDetails().containsKey("char_recall"));
    }
}
