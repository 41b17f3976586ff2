package ru.tigran.researchsignalengine.model;

import java.util.List;

/**
 * Minimal quote data needed to attach quotes to a signal.
 *
 * @param text verbatim quote text
 * @param participantId participant identifier
 * @param sessionId session identifier
 * @param startSeconds start of the quote in the session recording
 * @param intensity quote intensity on the 1-3 scale
 * @param tagNames specific tags the quote carries within the cell's category, empty if not applicable
 * @param segmentIndex 0-based ordinal in the session transcript, -1 if unknown
 */
public record QuoteRecord(
        String text,
        String participantId,
        String sessionId,
        double startSeconds,
        int intensity,
        List<String> tagNames,
        int segmentIndex
) {
    public static final int UNKNOWN_SEGMENT = -1;

    public QuoteRecord {
        tagNames = tagNames == null ? List.of() : List.copyOf(tagNames);
    }

    /**
     * Quote without tag metadata (sentiment analysis).
     */
    public QuoteRecord(String text, String participantId, String sessionId, double startSeconds, int intensity) {
        this(text, participantId, sessionId, startSeconds, intensity, List.of(), UNKNOWN_SEGMENT);
    }
}
