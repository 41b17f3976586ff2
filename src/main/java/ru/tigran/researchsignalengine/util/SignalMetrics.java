package ru.tigran.researchsignalengine.util;

import java.util.Collection;

/**
 * Statistical measures for contingency matrix cells.
 * Pure arithmetic: every function degrades to 0.0 on zero denominators,
 * because empty rows and columns are legitimate data states.
 */
public class SignalMetrics {

    /**
     * Upper bound of the intensity scale, used to normalize mean intensity.
     */
    public static final double MAX_INTENSITY = 3.0;

    private SignalMetrics() {
        // Private constructor to prevent instantiation
    }

    /**
     * How over-represented a category is within a location compared to the study overall.
     *
     * observed = cellCount / rowTotal   (rate within this location)
     * expected = colTotal / grandTotal  (overall rate of this category)
     *
     * Example: 5 of 10 quotes in a section are frustration, 10 of 100 overall -> 5.0
     *
     * @return observed / expected; 1.0 = as expected, > 1 over-represented, < 1 under-represented
     */
    public static double concentrationRatio(int cellCount, int rowTotal, int colTotal, int grandTotal) {
        if (grandTotal == 0 || rowTotal == 0 || colTotal == 0) {
            return 0.0;
        }
        double expected = (double) colTotal / grandTotal;
        if (expected == 0.0) {
            return 0.0;
        }
        double observed = (double) cellCount / rowTotal;
        return observed / expected;
    }

    /**
     * Effective number of voices (unbiased Simpson's diversity): N(N-1) / sum(ni(ni-1)).
     *
     * 9 quotes from 9 people -> 9.0 (broad agreement)
     * 9 quotes from 1 person -> 1.0 (one person's rant)
     *
     * @param participantCounts number of quotes per participant
     * @return effective voice count; N when N <= 1 or when every participant contributed once
     */
    public static double simpsonsNeff(Collection<Integer> participantCounts) {
        long n = 0;
        long sumNiNiMinus1 = 0;
        for (int ni : participantCounts) {
            n += ni;
            sumNiNiMinus1 += (long) ni * (ni - 1);
        }
        if (n <= 1) {
            return n;
        }
        if (sumNiNiMinus1 == 0) {
            // every quote from a different person
            return n;
        }
        return (double) (n * (n - 1)) / sumNiNiMinus1;
    }

    /**
     * Arithmetic mean of intensity values (1-3 scale), 0.0 for no values.
     */
    public static double meanIntensity(Collection<Integer> intensities) {
        if (intensities.isEmpty()) {
            return 0.0;
        }
        long sum = 0;
        for (int intensity : intensities) {
            sum += intensity;
        }
        return (double) sum / intensities.size();
    }

    /**
     * Single ranking score: concentration * (nEff / totalParticipants) * (meanIntensity / 3).
     * Concentrated-but-single-voice and concentrated-but-flat cells are penalized multiplicatively.
     *
     * @return composite score, 0.0 when there are no participants
     */
    public static double compositeSignal(double concentration, double nEff, int totalParticipants,
                                         double meanIntensity) {
        if (totalParticipants == 0) {
            return 0.0;
        }
        return concentration * (nEff / totalParticipants) * (meanIntensity / MAX_INTENSITY);
    }

    /**
     * Adjusted standardized residual of a cell under the independence hypothesis.
     * Values above 2 indicate notable concentration, below -2 notable depletion.
     *
     * @return residual, 0.0 when any total is zero or the variance term vanishes
     */
    public static double adjustedResidual(int observed, int rowTotal, int colTotal, int grandTotal) {
        if (grandTotal == 0 || rowTotal == 0 || colTotal == 0) {
            return 0.0;
        }
        double expected = (double) rowTotal * colTotal / grandTotal;
        if (expected == 0.0) {
            return 0.0;
        }
        double variance = expected
                * (1 - (double) rowTotal / grandTotal)
                * (1 - (double) colTotal / grandTotal);
        if (variance == 0.0) {
            return 0.0;
        }
        return (observed - expected) / Math.sqrt(variance);
    }
}
