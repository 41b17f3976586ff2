package ru.tigran.researchsignalengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.researchsignalengine.model.CellKey;
import ru.tigran.researchsignalengine.model.ConfidenceTier;
import ru.tigran.researchsignalengine.model.ContingencyMatrix;
import ru.tigran.researchsignalengine.model.MatrixCell;
import ru.tigran.researchsignalengine.model.QuoteRecord;
import ru.tigran.researchsignalengine.model.Signal;
import ru.tigran.researchsignalengine.model.SignalQuote;
import ru.tigran.researchsignalengine.model.SourceType;
import ru.tigran.researchsignalengine.util.SignalMetrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Detects signals (notable category concentrations) in contingency matrices
 * and merges them into a single ranked list.
 */
@Slf4j
@Component
public class SignalDetector {

    public static final int DEFAULT_TOP_N = 12;

    /**
     * A signal needs at least two contributions in its cell.
     */
    public static final int MIN_QUOTES_PER_CELL = 2;

    private static final Comparator<QuoteRecord> QUOTE_ORDER = Comparator
            .comparing(QuoteRecord::participantId)
            .thenComparingDouble(QuoteRecord::startSeconds);

    /**
     * Scans every cell of a matrix in row-label, then column-label order.
     *
     * @param matrix matrix to scan
     * @param sourceType which view the matrix represents
     * @param totalParticipants distinct participants in the study, for normalization
     * @param quoteLookup quotes belonging to each cell
     * @return one signal per cell with at least {@link #MIN_QUOTES_PER_CELL} contributions
     */
    public List<Signal> detect(
            ContingencyMatrix matrix,
            SourceType sourceType,
            int totalParticipants,
            Map<CellKey, List<QuoteRecord>> quoteLookup
    ) {
        List<Signal> signals = new ArrayList<>();
        for (String row : matrix.getRowLabels()) {
            for (String column : matrix.getColumnLabels()) {
                MatrixCell cell = matrix.cell(row, column);
                if (cell == null || cell.getCount() < MIN_QUOTES_PER_CELL) {
                    continue;
                }
                signals.add(toSignal(matrix, row, column, cell, sourceType, totalParticipants,
                        quoteLookup.getOrDefault(CellKey.of(row, column), List.of())));
            }
        }
        log.debug("Detected {} {} signals over {} rows", signals.size(), sourceType.getValue(),
                matrix.getRowLabels().size());
        return signals;
    }

    /**
     * Concatenates signal lists, sorts by composite score descending and keeps the first topN.
     * The sort is stable: equal scores keep their emission order.
     *
     * @param signalLists signals per matrix, in emission order
     * @param topN maximum number of signals to keep
     * @return ranked signals
     */
    public List<Signal> mergeAndRank(List<List<Signal>> signalLists, int topN) {
        List<Signal> all = new ArrayList<>();
        for (List<Signal> signals : signalLists) {
            all.addAll(signals);
        }
        all.sort(Comparator.comparingDouble(Signal::compositeSignal).reversed());
        return all.size() > topN ? List.copyOf(all.subList(0, topN)) : List.copyOf(all);
    }

    private Signal toSignal(
            ContingencyMatrix matrix,
            String row,
            String column,
            MatrixCell cell,
            SourceType sourceType,
            int totalParticipants,
            List<QuoteRecord> quotes
    ) {
        double nEff = SignalMetrics.simpsonsNeff(cell.getParticipants().values());
        double meanIntensity = SignalMetrics.meanIntensity(cell.getIntensities());
        double concentration = SignalMetrics.concentrationRatio(
                cell.getCount(),
                matrix.rowTotal(row),
                matrix.columnTotal(column),
                matrix.getGrandTotal()
        );
        double composite = SignalMetrics.compositeSignal(concentration, nEff, totalParticipants, meanIntensity);
        List<String> participants = cell.sortedParticipantIds();

        List<SignalQuote> signalQuotes = quotes.stream()
                .sorted(QUOTE_ORDER)
                .map(SignalQuote::from)
                .toList();

        return new Signal(
                row,
                sourceType,
                column,
                cell.getCount(),
                participants,
                nEff,
                meanIntensity,
                concentration,
                composite,
                ConfidenceTier.classify(concentration, participants.size(), cell.getCount()),
                signalQuotes
        );
    }
}
