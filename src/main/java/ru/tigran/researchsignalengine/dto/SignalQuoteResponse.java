package ru.tigran.researchsignalengine.dto;

import java.util.List;

public record SignalQuoteResponse(
        String text,
        String participantId,
        String sessionId,
        double startSeconds,
        int intensity,
        List<String> tagNames,
        int segmentIndex
) {
}
