package ru.tigran.researchsignalengine.service;

import org.springframework.stereotype.Component;
import ru.tigran.researchsignalengine.dto.AnalysisResponse;
import ru.tigran.researchsignalengine.dto.MatrixCellResponse;
import ru.tigran.researchsignalengine.dto.MatrixResponse;
import ru.tigran.researchsignalengine.dto.SignalQuoteResponse;
import ru.tigran.researchsignalengine.dto.SignalResponse;
import ru.tigran.researchsignalengine.model.AnalysisResult;
import ru.tigran.researchsignalengine.model.ContingencyMatrix;
import ru.tigran.researchsignalengine.model.MatrixCell;
import ru.tigran.researchsignalengine.model.Signal;
import ru.tigran.researchsignalengine.model.SignalQuote;
import ru.tigran.researchsignalengine.util.ParticipantIds;
import ru.tigran.researchsignalengine.util.SignalMetrics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts analysis results into client-facing responses.
 * Rounds metrics for display and computes adjusted residuals for every matrix cell.
 */
@Component
public class AnalysisResponseMapper {

    /**
     * @param result analysis result
     * @param tradeOffNote caveat to attach, or null
     * @return response DTO
     */
    public AnalysisResponse toResponse(AnalysisResult result, String tradeOffNote) {
        Set<String> signalParticipants = new LinkedHashSet<>();
        result.signals().forEach(signal -> signalParticipants.addAll(signal.participants()));

        return new AnalysisResponse(
                result.signals().stream().map(this::toSignalResponse).toList(),
                toMatrixResponse(result.sectionMatrix()),
                toMatrixResponse(result.themeMatrix()),
                result.totalParticipants(),
                result.categories(),
                ParticipantIds.naturalSort(signalParticipants),
                tradeOffNote
        );
    }

    public MatrixResponse toMatrixResponse(ContingencyMatrix matrix) {
        List<MatrixCellResponse> cells = new ArrayList<>();
        for (String row : matrix.getRowLabels()) {
            for (String column : matrix.getColumnLabels()) {
                MatrixCell cell = matrix.cell(row, column);
                double residual = SignalMetrics.adjustedResidual(
                        cell.getCount(),
                        matrix.rowTotal(row),
                        matrix.columnTotal(column),
                        matrix.getGrandTotal()
                );
                cells.add(new MatrixCellResponse(
                        row,
                        column,
                        cell.getCount(),
                        round(cell.getWeightedCount(), 4),
                        new LinkedHashMap<>(cell.getParticipants()),
                        List.copyOf(cell.getIntensities()),
                        round(residual, 2)
                ));
            }
        }
        return new MatrixResponse(
                matrix.getRowLabels(),
                matrix.getColumnLabels(),
                cells,
                new LinkedHashMap<>(matrix.getRowTotals()),
                new LinkedHashMap<>(matrix.getColumnTotals()),
                matrix.getGrandTotal()
        );
    }

    private SignalResponse toSignalResponse(Signal signal) {
        return new SignalResponse(
                signal.location(),
                signal.sourceType().getValue(),
                signal.category(),
                signal.count(),
                signal.participants(),
                round(signal.nEff(), 2),
                round(signal.meanIntensity(), 2),
                round(signal.concentration(), 2),
                round(signal.compositeSignal(), 4),
                signal.confidence().getValue(),
                signal.quotes().stream().map(this::toQuoteResponse).toList()
        );
    }

    private SignalQuoteResponse toQuoteResponse(SignalQuote quote) {
        return new SignalQuoteResponse(
                quote.text(),
                quote.participantId(),
                quote.sessionId(),
                quote.startSeconds(),
                quote.intensity(),
                quote.tagNames(),
                quote.segmentIndex()
        );
    }

    private static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        // Exact binary value: 2.675 is stored as 2.67499... and rounds to 2.67
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }
}
