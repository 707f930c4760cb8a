package com.aiBench.translationBench.evaluation.model;

/**
 * Discrete quality bands used in explanations.
 */
public enum QualityLabel {
    EXCELLENT("Excellent", 90.0),
    GOOD("Good", 75.0),
    FAIR("Fair", 60.0),
    POOR("Poor", Double.NEGATIVE_INFINITY);

    private final String displayName;
    private final double lowerBound;

    QualityLabel(String displayName, double lowerBound) {
        this.displayName = displayName;
        this.lowerBound = lowerBound;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static QualityLabel fromScore(double score) {
        for (QualityLabel label : values()) {
            if (score >= label.lowerBound) {
                return label;
            }
        }
        return POOR;
    }
}
