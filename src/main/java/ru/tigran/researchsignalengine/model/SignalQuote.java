package ru.tigran.researchsignalengine.model;

import java.util.List;

/**
 * A quote attached to a signal card.
 */
public record SignalQuote(
        String text,
        String participantId,
        String sessionId,
        double startSeconds,
        int intensity,
        List<String> tagNames,
        int segmentIndex
) {
    public SignalQuote {
        tagNames = tagNames == null ? List.of() : List.copyOf(tagNames);
    }

    public static SignalQuote from(QuoteRecord quote) {
        return new SignalQuote(
                quote.text(),
                quote.participantId(),
                quote.sessionId(),
                quote.startSeconds(),
                quote.intensity(),
                quote.tagNames(),
                quote.segmentIndex()
        );
    }
}
