package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricScore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that content which should survive translation unchanged does survive:
 * numbers, the punctuation pattern and capitalized names.
 * Enabled sub-checks are averaged with equal weight.
 */
public class PreservationMetric implements QualityMetric {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\b\\d+(?:[.,]\\d+)?%?\\b");

    private static final String ASCII_PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    private static final double WARNING_THRESHOLD = 80.0;

    private final boolean checkNumbers;
    private final boolean checkPunctuation;
    private final boolean checkEntities;

    public PreservationMetric(boolean checkNumbers, boolean checkPunctuation, boolean checkEntities) {
        this.checkNumbers = checkNumbers;
        this.checkPunctuation = checkPunctuation;
        this.checkEntities = checkEntities;
    }

    @Override
    public String getName() {
        return MetricNames.PRESERVATION;
    }

    @Override
    public boolean isApplicable(EvaluationInput input) {
        return checkNumbers || checkPunctuation || checkEntities;
    }

    @Override
    public MetricScore evaluate(EvaluationInput input) {
        String source = input.getSourceText();
        String translated = input.getTranslatedText() == null ? "" : input.getTranslatedText();

        MetricScore.MetricScoreBuilder result = MetricScore.builder();
        List<Double> subScores = new ArrayList<>();

        if (checkNumbers) {
            Set<String> sourceNumbers = findNumbers(source);
            Set<String> translatedNumbers = findNumbers(translated);
            List<String> missing = sourceNumbers.stream()
                    .filter(number -> !translatedNumbers.contains(number))
                    .toList();
            double score = coverage(sourceNumbers.size(), sourceNumbers.size() - missing.size());
            subScores.add(score);
            result.detail("numbers_score", score).detail("missing_numbers", missing);
            if (!missing.isEmpty()) {
                result.warning(String.format("Potential content loss detected: %d number(s) not preserved",
                        missing.size()));
            }
        }

        if (checkPunctuation) {
            String sourceMarks = punctuationOf(source);
            String translatedMarks = punctuationOf(translated);
            long kept = sourceMarks.chars().filter(mark -> translatedMarks.indexOf(mark) >= 0).count();
            double score = coverage(sourceMarks.length(), kept);
            subScores.add(score);
            result.detail("punctuation_score", score);
            if (score < WARNING_THRESHOLD) {
                result.warning("Format preservation issues detected: punctuation pattern differs");
            }
        }

        if (checkEntities) {
            Set<String> sourceEntities = findCapitalizedTokens(source);
            Set<String> translatedTokens = findTokens(translated);
            long kept = sourceEntities.stream().filter(translatedTokens::contains).count();
            double score = coverage(sourceEntities.size(), kept);
            subScores.add(score);
            result.detail("entities_score", score);
            if (score < WARNING_THRESHOLD) {
                result.warning("Potential content loss detected: some capitalized words not preserved");
            }
        }

        double average = subScores.stream().mapToDouble(Double::doubleValue).average().orElse(100.0);
        return result.score(average).build();
    }

    private static double coverage(long expected, long found) {
        return expected == 0 ? 100.0 : (double) found / expected * 100.0;
    }

    private static Set<String> findNumbers(String text) {
        Set<String> numbers = new LinkedHashSet<>();
        Matcher matcher = NUMBER_PATTERN.matcher(text);
        while (matcher.find()) {
            numbers.add(matcher.group());
        }
        return numbers;
    }

    private static String punctuationOf(String text) {
        StringBuilder marks = new StringBuilder();
        text.chars()
                .filter(c -> ASCII_PUNCTUATION.indexOf(c) >= 0)
                .forEach(c -> marks.append((char) c));
        return marks.toString();
    }

    /**
     * Capitalized tokens that do not open a sentence, with surrounding punctuation stripped.
     */
    private static Set<String> findCapitalizedTokens(String text) {
        Set<String> entities = new LinkedHashSet<>();
        boolean sentenceStart = true;
        for (String raw : text.trim().split("\\s+")) {
            String token = stripPunctuation(raw);
            if (!token.isEmpty() && !sentenceStart && Character.isUpperCase(token.codePointAt(0))) {
                entities.add(token);
            }
            sentenceStart = raw.endsWith(".") || raw.endsWith("!") || raw.endsWith("?");
        }
        return entities;
    }

    private static Set<String> findTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String raw : text.trim().split("\\s+")) {
            String token = stripPunctuation(raw);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String stripPunctuation(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && !Character.isLetterOrDigit(token.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }
}
