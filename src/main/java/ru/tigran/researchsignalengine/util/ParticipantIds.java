package ru.tigran.researchsignalengine.util;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers for participant identifiers such as "p1", "p12", "m1".
 * Participants carry the "p" prefix; moderators ("m") and observers ("o") do not count.
 */
public class ParticipantIds {

    public static final String PARTICIPANT_PREFIX = "p";

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    /**
     * Orders by the role letter, then by the numeric tail: "p2" before "p10".
     * A tail that is not all digits ranks as 0, so "p1a" sorts before "p1"; ties fall back to
     * lexicographic order.
     */
    public static final Comparator<String> NATURAL_ORDER = Comparator
            .comparing(ParticipantIds::roleLetter)
            .thenComparingLong(ParticipantIds::number)
            .thenComparing(Comparator.naturalOrder());

    private ParticipantIds() {
        // Private constructor to prevent instantiation
    }

    public static boolean isParticipant(String id) {
        return id != null && id.startsWith(PARTICIPANT_PREFIX);
    }

    /**
     * Counts distinct participant ids, ignoring moderators and observers.
     */
    public static int countParticipants(Collection<String> ids) {
        return (int) ids.stream()
                .filter(ParticipantIds::isParticipant)
                .distinct()
                .count();
    }

    public static List<String> naturalSort(Collection<String> ids) {
        return ids.stream()
                .distinct()
                .sorted(NATURAL_ORDER)
                .toList();
    }

    private static String roleLetter(String id) {
        return id.isEmpty() ? "" : id.substring(0, 1);
    }

    private static long number(String id) {
        String tail = id.length() > 1 ? id.substring(1) : "";
        if (!DIGITS.matcher(tail).matches()) {
            return 0L;
        }
        // Avoid overflow on absurdly long suffixes
        return tail.length() > 18 ? Long.MAX_VALUE : Long.parseLong(tail);
    }
}
