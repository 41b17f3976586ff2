package ru.tigran.researchsignalengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.researchsignalengine.model.ContingencyMatrix;
import ru.tigran.researchsignalengine.model.QuoteContribution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Builds contingency matrices from quote contributions.
 *
 * Two entry points share one fold:
 * - {@link #build} takes contributions already fanned out by the caller (weighted tag analysis)
 * - {@link #buildFixed} takes quotes with at most one category each (sentiment analysis)
 *
 * The builder only counts. Contributions with unknown labels are dropped silently.
 */
@Slf4j
@Component
public class MatrixBuilder {

    /**
     * Builds a row x column matrix from explicit contributions.
     *
     * @param contributions one entry per (quote, row, column) membership
     * @param rowLabels row order of the matrix
     * @param columnLabels column order of the matrix
     * @return populated matrix
     */
    public ContingencyMatrix build(
            Collection<QuoteContribution> contributions,
            List<String> rowLabels,
            List<String> columnLabels
    ) {
        ContingencyMatrix matrix = new ContingencyMatrix(rowLabels, columnLabels);
        for (QuoteContribution contribution : contributions) {
            matrix.accept(contribution);
        }
        log.debug("Built {}x{} matrix from {} contributions, grand total {}",
                rowLabels.size(), columnLabels.size(), contributions.size(), matrix.getGrandTotal());
        return matrix;
    }

    /**
     * Builds a matrix from quotes carrying a single, nullable category.
     * Each quote with a category becomes exactly one full-weight contribution;
     * quotes without a category are excluded entirely.
     *
     * @param quotes quotes to tabulate
     * @param rowLabelOf row label of a quote (its section or theme)
     * @param categoryOf category of a quote, or null
     * @param participantOf participant id of a quote
     * @param intensityOf intensity of a quote
     * @param rowLabels row order of the matrix
     * @param columnLabels closed category vocabulary
     * @return populated matrix
     */
    public <Q> ContingencyMatrix buildFixed(
            Collection<Q> quotes,
            Function<Q, String> rowLabelOf,
            Function<Q, String> categoryOf,
            Function<Q, String> participantOf,
            Function<Q, Integer> intensityOf,
            List<String> rowLabels,
            List<String> columnLabels
    ) {
        List<QuoteContribution> contributions = new ArrayList<>(quotes.size());
        for (Q quote : quotes) {
            String category = categoryOf.apply(quote);
            if (category == null) {
                continue;
            }
            contributions.add(new QuoteContribution(
                    rowLabelOf.apply(quote),
                    category,
                    participantOf.apply(quote),
                    intensityOf.apply(quote)
            ));
        }
        return build(contributions, rowLabels, columnLabels);
    }
}
