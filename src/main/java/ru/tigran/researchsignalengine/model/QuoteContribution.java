package ru.tigran.researchsignalengine.model;

/**
 * One quote's membership in a single (row, column) cell.
 *
 * A quote that belongs to several categories produces one contribution per category.
 * Weight is 1.0 for confirmed membership and the proposal confidence (0.0-1.0)
 * for unconfirmed machine-assigned tags.
 *
 * @param rowLabel location label (section or theme)
 * @param columnLabel category label (sentiment, codebook group, ...)
 * @param participantId participant who said the quote
 * @param intensity quote intensity on the 1-3 scale
 * @param weight membership weight
 */
public record QuoteContribution(
        String rowLabel,
        String columnLabel,
        String participantId,
        int intensity,
        double weight
) {
    public static final double FULL_WEIGHT = 1.0;

    /**
     * Full-weight contribution.
     */
    public QuoteContribution(String rowLabel, String columnLabel, String participantId, int intensity) {
        this(rowLabel, columnLabel, participantId, intensity, FULL_WEIGHT);
    }

    public CellKey cellKey() {
        return CellKey.of(rowLabel, columnLabel);
    }
}
