package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricScore;
import com.aiBench.translationBench.language.model.LanguageDetectionResult;
import com.aiBench.translationBench.language.service.LanguageDetector;

/**
 * Checks that the translation is written in the requested target language.
 */
public class LanguageMatchMetric implements QualityMetric {

    static final double UNDETERMINED_SCORE = 50.0;

    private final LanguageDetector languageDetector;
    private final double confidenceFloor;

    public LanguageMatchMetric(LanguageDetector languageDetector, double confidenceFloor) {
        this.languageDetector = languageDetector;
        this.confidenceFloor = confidenceFloor;
    }

    @Override
    public String getName() {
        return MetricNames.LANGUAGE_MATCH;
    }

    @Override
    public MetricScore evaluate(EvaluationInput input) {
        String translated = input.getTranslatedText();
        if (translated == null || translated.isBlank()) {
            return MetricScore.builder()
                    .score(0.0)
                    .warning("Empty translation")
                    .build();
        }

        if (!languageDetector.supports(input.getTargetLang())) {
            return MetricScore.builder()
                    .score(UNDETERMINED_SCORE)
                    .detail("expected_language", input.getTargetLang())
                    .detail("detected_language", LanguageDetectionResult.UNDETERMINED)
                    .detail("confidence", 0.0)
                    .warning(String.format("Language '%s' cannot be verified by the language detector",
                            input.getTargetLang()))
                    .build();
        }

        LanguageDetectionResult detection = languageDetector.detectLanguage(translated);
        MetricScore.MetricScoreBuilder result = MetricScore.builder()
                .detail("expected_language", input.getTargetLang())
                .detail("detected_language", detection.getLanguageCode())
                .detail("confidence", detection.getConfidence());

        if (!detection.isDetermined()) {
            return result.score(UNDETERMINED_SCORE)
                    .warning("Could not determine the language of the translation")
                    .build();
        }

        if (!detection.matches(input.getTargetLang())) {
            return result.score(0.0)
                    .warning(String.format("Language mismatch: expected '%s', detected '%s'",
                            input.getTargetLang(), detection.getLanguageCode()))
                    .build();
        }

        if (detection.getConfidence() >= confidenceFloor) {
            return result.score(100.0).build();
        }
        return result.score(detection.getConfidence() * 100.0)
                .warning("Low confidence in language detection")
                .build();
    }
}
