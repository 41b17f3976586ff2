package ru.tigran.researchsignalengine.model;

import java.util.List;

/**
 * A notable concentration of one category at one location.
 *
 * @param location row label the signal was found in
 * @param sourceType matrix the signal came from
 * @param category column label (sentiment value or codebook group name)
 * @param count raw contribution count of the cell
 * @param participants sorted unique participant ids present in the cell
 * @param nEff effective number of voices
 * @param meanIntensity mean quote intensity
 * @param concentration concentration ratio
 * @param compositeSignal ranking score
 * @param confidence confidence tier
 * @param quotes quotes sorted by participant id, then start time
 */
public record Signal(
        String location,
        SourceType sourceType,
        String category,
        int count,
        List<String> participants,
        double nEff,
        double meanIntensity,
        double concentration,
        double compositeSignal,
        ConfidenceTier confidence,
        List<SignalQuote> quotes
) {
    public Signal {
        participants = List.copyOf(participants);
        quotes = List.copyOf(quotes);
    }
}
