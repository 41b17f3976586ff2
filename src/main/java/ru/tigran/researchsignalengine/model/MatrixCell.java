package ru.tigran.researchsignalengine.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One (location, category) cell of a contingency matrix.
 *
 * Invariant: count == sum of participant counts == number of intensities.
 */
@Getter
public class MatrixCell {

    private int count;

    // Sum of contribution weights; equals count when every weight is 1.0
    private double weightedCount;

    private final Map<String, Integer> participants = new LinkedHashMap<>();
    private final List<Integer> intensities = new ArrayList<>();

    void add(String participantId, int intensity, double weight) {
        count++;
        weightedCount += weight;
        participants.merge(participantId, 1, Integer::sum);
        intensities.add(intensity);
    }

    public Map<String, Integer> getParticipants() {
        return Collections.unmodifiableMap(participants);
    }

    public List<Integer> getIntensities() {
        return Collections.unmodifiableList(intensities);
    }

    /**
     * @return participant ids present in this cell, sorted lexicographically
     */
    public List<String> sortedParticipantIds() {
        return participants.keySet().stream()
                .sorted()
                .toList();
    }
}
