package ru.tigran.researchsignalengine.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.researchsignalengine.dto.AnalysisResponse;
import ru.tigran.researchsignalengine.dto.MatrixCellResponse;
import ru.tigran.researchsignalengine.dto.MatrixResponse;
import ru.tigran.researchsignalengine.dto.SignalResponse;
import ru.tigran.researchsignalengine.model.AnalysisResult;
import ru.tigran.researchsignalengine.model.ConfidenceTier;
import ru.tigran.researchsignalengine.model.ContingencyMatrix;
import ru.tigran.researchsignalengine.model.QuoteContribution;
import ru.tigran.researchsignalengine.model.Signal;
import ru.tigran.researchsignalengine.model.SignalQuote;
import ru.tigran.researchsignalengine.model.SourceType;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalysisResponseMapper unit тесты")
class AnalysisResponseMapperTest {

    private final AnalysisResponseMapper mapper = new AnalysisResponseMapper();

    private ContingencyMatrix diagonalMatrix() {
        List<QuoteContribution> contributions = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            contributions.add(new QuoteContribution("Checkout", "Friction", "p" + i, 2));
            contributions.add(new QuoteContribution("Search", "Delight", "p" + (i + 4), 3, 0.33333));
        }
        return new MatrixBuilder().build(contributions, List.of("Checkout", "Search"), List.of("Friction", "Delight"));
    }

    @Test
    @DisplayName("ячейки матрицы идут построчно с остатками, округлёнными до 2 знаков")
    void matrixCellsRowMajor() {
        MatrixResponse response = mapper.toMatrixResponse(diagonalMatrix());

        assertEquals(List.of("Checkout|Friction", "Checkout|Delight", "Search|Friction", "Search|Delight"),
                response.cells().stream().map(c -> c.row() + "|" + c.column()).toList());

        MatrixCellResponse concentrated = response.cells().get(0);
        assertEquals(4, concentrated.count());
        assertEquals(2.83, concentrated.adjustedResidual());
        assertEquals(-2.83, response.cells().get(1).adjustedResidual());
        assertEquals(1.3333, response.cells().get(3).weightedCount());
        assertEquals(8, response.grandTotal());
        assertEquals(4, response.rowTotals().get("Checkout"));
    }

    @Test
    @DisplayName("пустая матрица даёт нулевые остатки без ошибок")
    void emptyMatrixResiduals() {
        MatrixResponse response = mapper.toMatrixResponse(
                new ContingencyMatrix(List.of("Checkout"), List.of("Friction")));

        assertEquals(0.0, response.cells().get(0).adjustedResidual());
        assertEquals(0, response.grandTotal());
    }

    @Test
    @DisplayName("метрики сигнала округляются, участники сортируются естественно")
    void signalRoundingAndParticipants() {
        Signal signal = new Signal("Checkout", SourceType.THEME, "Friction", 3,
                List.of("p10", "p2"), 1.98765, 2.33333, 2.123456, 0.1234567, ConfidenceTier.MODERATE,
                List.of(new SignalQuote("text", "p2", "s1", 12.5, 2, List.of("slow"), 4)));
        AnalysisResult result = new AnalysisResult(diagonalMatrix(), ContingencyMatrix.empty(), List.of(signal), 10,
                List.of("Friction", "Delight"));

        AnalysisResponse response = mapper.toResponse(result, "note");

        SignalResponse mapped = response.signals().get(0);
        assertEquals("theme", mapped.sourceType());
        assertEquals("moderate", mapped.confidence());
        assertEquals(1.99, mapped.nEff());
        assertEquals(2.33, mapped.meanIntensity());
        assertEquals(2.12, mapped.concentration());
        assertEquals(0.1235, mapped.compositeSignal());
        assertEquals(List.of("slow"), mapped.quotes().get(0).tagNames());
        assertEquals(4, mapped.quotes().get(0).segmentIndex());

        assertEquals(List.of("p2", "p10"), response.participantIds());
        assertEquals(List.of("Friction", "Delight"), response.columns());
        assertEquals(10, response.totalParticipants());
        assertEquals("note", response.tradeOffNote());
    }

    @Test
    @DisplayName("округление идёт по точному двоичному значению: 107/40 даёт 2.67")
    void roundingUsesExactBinaryValue() {
        Signal signal = new Signal("Checkout", SourceType.SECTION, "Friction", 40,
                List.of("p1"), 2.675, 107.0 / 40.0, 1.005, 0.00015, ConfidenceTier.EMERGING, List.of());
        AnalysisResult result = new AnalysisResult(ContingencyMatrix.empty(), ContingencyMatrix.empty(),
                List.of(signal), 1, List.of("Friction"));

        SignalResponse mapped = mapper.toResponse(result, null).signals().get(0);

        assertEquals(2.67, mapped.meanIntensity());
        assertEquals(2.67, mapped.nEff());
        assertEquals(1.0, mapped.concentration());
        assertEquals(0.0001, mapped.compositeSignal());
    }

    @Test
    @DisplayName("пустой результат анализа отображается без сигналов")
    void emptyResult() {
        AnalysisResponse response = mapper.toResponse(AnalysisResult.empty(), null);

        assertTrue(response.signals().isEmpty());
        assertTrue(response.participantIds().isEmpty());
        assertTrue(response.sectionMatrix().cells().isEmpty());
        assertNull(response.tradeOffNote());
    }
}
