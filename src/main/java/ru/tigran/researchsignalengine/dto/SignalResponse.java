package ru.tigran.researchsignalengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Signal card as returned to the client.
 * nEff, meanIntensity and concentration are rounded to 2 decimals, compositeSignal to 4.
 */
public record SignalResponse(
        String location,
        String sourceType,
        String category,
        int count,
        List<String> participants,
        @JsonProperty("nEff") double nEff,
        double meanIntensity,
        double concentration,
        double compositeSignal,
        String confidence,
        List<SignalQuoteResponse> quotes
) {
}
