package ru.tigran.researchsignalengine.dto;

import java.util.List;

/**
 * Full analysis result.
 *
 * Example (abridged):
 * {
 *   "signals": [{"location": "Checkout", "sourceType": "section", "category": "frustration", ...}],
 *   "sectionMatrix": {...},
 *   "themeMatrix": {...},
 *   "totalParticipants": 8,
 *   "columns": ["frustration", "confusion", ...],
 *   "participantIds": ["p1", "p2", "p10"]
 * }
 *
 * @param participantIds participants appearing in any returned signal, naturally sorted
 * @param tradeOffNote caveat about multi-group counting (tag analysis only, omitted otherwise)
 */
public record AnalysisResponse(
        List<SignalResponse> signals,
        MatrixResponse sectionMatrix,
        MatrixResponse themeMatrix,
        int totalParticipants,
        List<String> columns,
        List<String> participantIds,
        String tradeOffNote
) {
}
