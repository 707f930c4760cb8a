package com.aiBench.translationBench.language.service;

import com.aiBench.translationBench.language.model.LanguageDetectionResult;
import com.github.pemistahl.lingua.api.Language;
import com.github.pemistahl.lingua.api.LanguageDetectorBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Language Detector service, backed by the Lingua statistical n-gram models.
 *
 * Detection strategy:
 * - Text without letters is undetermined
 * - Otherwise Lingua ranks every supported language; the top candidate wins and its
 *   probability is the confidence
 * - Codes Lingua does not know (see {@link #supports(String)}) can never be confirmed
 *   or refuted, so callers treat them as undetermined
 *
 * Models are loaded lazily per language on first use and shared by all threads.
 */
@Slf4j
@Service
public class LanguageDetector {

    private final com.github.pemistahl.lingua.api.LanguageDetector detector;

    private final Set<String> supportedCodes;

    public LanguageDetector() {
        this.detector = LanguageDetectorBuilder.fromAllLanguages().build();
        this.supportedCodes = Arrays.stream(Language.values())
                .filter(language -> language != Language.UNKNOWN)
                .map(LanguageDetector::isoCode)
                .collect(Collectors.toUnmodifiableSet());
        log.info("Language detector initialized - languages: {}", supportedCodes.size());
    }

    /**
     * Detects the language of the given text.
     *
     * @param text The text to analyze
     * @return LanguageDetectionResult with the language code and confidence
     */
    public LanguageDetectionResult detectLanguage(String text) {
        if (text == null || text.codePoints().noneMatch(Character::isLetter)) {
            log.debug("No letters provided for language detection");
            return LanguageDetectionResult.undetermined();
        }

        Map<Language, Double> confidences = detector.computeLanguageConfidenceValues(text);
        Map<String, Double> scores = new LinkedHashMap<>();
        Language best = Language.UNKNOWN;
        double bestConfidence = 0.0;
        for (Map.Entry<Language, Double> entry : confidences.entrySet()) {
            if (entry.getKey() == Language.UNKNOWN || entry.getValue() <= 0.0) {
                continue;
            }
            scores.put(isoCode(entry.getKey()), entry.getValue());
            if (entry.getValue() > bestConfidence) {
                best = entry.getKey();
                bestConfidence = entry.getValue();
            }
        }

        if (best == Language.UNKNOWN) {
            log.debug("Language detection - no candidate language");
            return LanguageDetectionResult.undetermined();
        }

        String code = isoCode(best);
        log.debug("Language detection - detected: {}, confidence: {}", code, bestConfidence);
        return LanguageDetectionResult.builder()
                .languageCode(code)
                .confidence(Math.min(1.0, bestConfidence))
                .scores(scores)
                .build();
    }

    /**
     * Whether the detector can recognize the given language, compared on the primary subtag.
     */
    public boolean supports(String languageCode) {
        return languageCode != null && !languageCode.isBlank()
                && supportedCodes.contains(LanguageDetectionResult.canonicalCode(languageCode));
    }

    private static String isoCode(Language language) {
        return language.getIsoCode639_1().name().toLowerCase(Locale.ROOT);
    }
}
