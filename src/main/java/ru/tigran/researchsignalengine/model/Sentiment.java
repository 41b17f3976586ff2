package ru.tigran.researchsignalengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Closed sentiment vocabulary assigned to extracted quotes.
 * Declaration order is the canonical column order of sentiment matrices.
 */
public enum Sentiment {
    FRUSTRATION("frustration"),
    CONFUSION("confusion"),
    DOUBT("doubt"),
    SURPRISE("surprise"),
    SATISFACTION("satisfaction"),
    DELIGHT("delight"),
    CONFIDENCE("confidence");

    private final String value;

    Sentiment(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Canonical column labels for sentiment analysis.
     *
     * @return lower-case sentiment values in declaration order
     */
    public static List<String> labels() {
        return Arrays.stream(values())
                .map(Sentiment::getValue)
                .toList();
    }

    /**
     * Get Sentiment by string value (case-insensitive)
     * @param value the string value ("frustration", "delight", ...)
     * @return Sentiment enum or throws IllegalArgumentException if not found
     */
    @JsonCreator
    public static Sentiment fromValue(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Sentiment value cannot be null or empty");
        }
        for (Sentiment sentiment : values()) {
            if (sentiment.value.equalsIgnoreCase(value)) {
                return sentiment;
            }
        }
        throw new IllegalArgumentException("Invalid sentiment value: " + value);
    }
}
