package ru.tigran.researchsignalengine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence tier of a detected signal.
 *
 * Thresholds (all comparisons on concentration are strict):
 * - STRONG: concentration > 2.0, at least 5 participants, at least 6 quotes
 * - MODERATE: concentration > 1.5, at least 3 participants, at least 4 quotes
 * - EMERGING: everything else that reached the detector
 */
public enum ConfidenceTier {
    STRONG("strong"),
    MODERATE("moderate"),
    EMERGING("emerging");

    private static final double STRONG_CONCENTRATION = 2.0;
    private static final int STRONG_PARTICIPANTS = 5;
    private static final int STRONG_COUNT = 6;

    private static final double MODERATE_CONCENTRATION = 1.5;
    private static final int MODERATE_PARTICIPANTS = 3;
    private static final int MODERATE_COUNT = 4;

    private final String value;

    ConfidenceTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Classifies a cell by its concentration, unique participant count and raw count.
     *
     * @param concentration concentration ratio of the cell
     * @param uniqueParticipants number of distinct participants in the cell
     * @param count raw contribution count of the cell
     * @return confidence tier
     */
    public static ConfidenceTier classify(double concentration, int uniqueParticipants, int count) {
        if (concentration > STRONG_CONCENTRATION
                && uniqueParticipants >= STRONG_PARTICIPANTS
                && count >= STRONG_COUNT) {
            return STRONG;
        }
        if (concentration > MODERATE_CONCENTRATION
                && uniqueParticipants >= MODERATE_PARTICIPANTS
                && count >= MODERATE_COUNT) {
            return MODERATE;
        }
        return EMERGING;
    }
}
