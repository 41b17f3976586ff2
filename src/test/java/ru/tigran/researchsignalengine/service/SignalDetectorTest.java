package ru.tigran.researchsignalengine.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.researchsignalengine.model.CellKey;
import ru.tigran.researchsignalengine.model.ConfidenceTier;
import ru.tigran.researchsignalengine.model.ContingencyMatrix;
import ru.tigran.researchsignalengine.model.QuoteContribution;
import ru.tigran.researchsignalengine.model.QuoteRecord;
import ru.tigran.researchsignalengine.model.Signal;
import ru.tigran.researchsignalengine.model.SignalQuote;
import ru.tigran.researchsignalengine.model.SourceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SignalDetector unit тесты")
class SignalDetectorTest {

    private final MatrixBuilder matrixBuilder = new MatrixBuilder();
    private final SignalDetector signalDetector = new SignalDetector();

    private static final List<String> ROWS = List.of("Checkout", "Search");
    private static final List<String> COLUMNS = List.of("Friction", "Delight");

    private List<QuoteContribution> cell(String row, String column, String... participants) {
        List<QuoteContribution> contributions = new ArrayList<>();
        for (String participant : participants) {
            contributions.add(new QuoteContribution(row, column, participant, 2));
        }
        return contributions;
    }

    private ContingencyMatrix matrix(List<List<QuoteContribution>> cells) {
        List<QuoteContribution> all = new ArrayList<>();
        cells.forEach(all::addAll);
        return matrixBuilder.build(all, ROWS, COLUMNS);
    }

    @Test
    @DisplayName("ячейка с одной цитатой не даёт сигнала")
    void singleQuoteNoSignal() {
        ContingencyMatrix matrix = matrix(List.of(cell("Checkout", "Friction", "p1")));

        assertTrue(signalDetector.detect(matrix, SourceType.SECTION, 5, Map.of()).isEmpty());
    }

    @Test
    @DisplayName("ячейка с двумя цитатами даёт сигнал")
    void twoQuotesProduceSignal() {
        ContingencyMatrix matrix = matrix(List.of(cell("Checkout", "Friction", "p1", "p2")));

        List<Signal> signals = signalDetector.detect(matrix, SourceType.SECTION, 5, Map.of());

        assertEquals(1, signals.size());
        Signal signal = signals.get(0);
        assertEquals("Checkout", signal.location());
        assertEquals(SourceType.SECTION, signal.sourceType());
        assertEquals("Friction", signal.category());
        assertEquals(2, signal.count());
        assertEquals(List.of("p1", "p2"), signal.participants());
        assertEquals(ConfidenceTier.EMERGING, signal.confidence());
        assertTrue(signal.quotes().isEmpty());
    }

    @Test
    @DisplayName("сценарий Checkout/Search: концентрация 2.0 даёт moderate")
    void checkoutSearchScenario() {
        ContingencyMatrix matrix = matrix(List.of(
                cell("Checkout", "Friction", "p1", "p2", "p3", "p4"),
                cell("Search", "Delight", "p5", "p6", "p7", "p8")
        ));

        List<Signal> signals = signalDetector.detect(matrix, SourceType.SECTION, 8, Map.of());

        assertEquals(2, signals.size());
        Signal checkout = signals.get(0);
        assertEquals("Checkout", checkout.location());
        assertEquals(2.0, checkout.concentration(), 1e-9);
        assertEquals(4.0, checkout.nEff(), 1e-9);
        assertEquals(2.0, checkout.meanIntensity(), 1e-9);
        // 2.0 * (4 / 8) * (2 / 3)
        assertEquals(2.0 / 3.0, checkout.compositeSignal(), 1e-9);
        assertEquals(ConfidenceTier.MODERATE, checkout.confidence());
    }

    @Test
    @DisplayName("strong при концентрации > 2 и достаточном числе участников")
    void strongSignal() {
        ContingencyMatrix matrix = matrix(List.of(
                cell("Checkout", "Friction", "p1", "p2", "p3", "p4", "p5", "p6"),
                cell("Search", "Delight", "p1", "p2", "p3", "p4", "p5", "p6", "p7", "p8", "p9", "p10"),
                cell("Search", "Friction", "p7")
        ));

        List<Signal> signals = signalDetector.detect(matrix, SourceType.SECTION, 10, Map.of());

        Signal checkout = signals.stream().filter(s -> s.location().equals("Checkout")).findFirst().orElseThrow();
        // (6/6) / (7/17)
        assertEquals(17.0 / 7.0, checkout.concentration(), 1e-9);
        assertEquals(ConfidenceTier.STRONG, checkout.confidence());
    }

    @Test
    @DisplayName("один голос: много цитат от одного участника дают nEff = 1")
    void singleVoiceDomination() {
        ContingencyMatrix matrix = matrix(List.of(cell("Checkout", "Friction", "p1", "p1", "p1", "p1", "p1", "p1")));

        Signal signal = signalDetector.detect(matrix, SourceType.SECTION, 6, Map.of()).get(0);

        assertEquals(1.0, signal.nEff(), 1e-9);
        assertEquals(List.of("p1"), signal.participants());
        assertEquals(ConfidenceTier.EMERGING, signal.confidence());
    }

    @Test
    @DisplayName("цитаты сортируются по участнику, затем по времени")
    void quotesSorted() {
        ContingencyMatrix matrix = matrix(List.of(cell("Checkout", "Friction", "p2", "p1", "p1")));
        Map<CellKey, List<QuoteRecord>> lookup = Map.of(
                CellKey.of("Checkout", "Friction"),
                List.of(
                        new QuoteRecord("late p1", "p1", "s1", 90.0, 2),
                        new QuoteRecord("p2", "p2", "s2", 5.0, 2),
                        new QuoteRecord("early p1", "p1", "s1", 10.0, 2)
                )
        );

        Signal signal = signalDetector.detect(matrix, SourceType.SECTION, 2, lookup).get(0);

        assertEquals(List.of("early p1", "late p1", "p2"),
                signal.quotes().stream().map(SignalQuote::text).toList());
        SignalQuote first = signal.quotes().get(0);
        assertTrue(first.tagNames().isEmpty());
        assertEquals(-1, first.segmentIndex());
    }

    @Test
    @DisplayName("теги и номер сегмента переносятся в цитаты сигнала")
    void quoteMetadataCarried() {
        ContingencyMatrix matrix = matrix(List.of(cell("Checkout", "Friction", "p1", "p2")));
        Map<CellKey, List<QuoteRecord>> lookup = Map.of(
                CellKey.of("Checkout", "Friction"),
                List.of(new QuoteRecord("text", "p1", "s1", 1.0, 3, List.of("slow", "broken"), 7))
        );

        SignalQuote quote = signalDetector.detect(matrix, SourceType.THEME, 2, lookup).get(0).quotes().get(0);

        assertEquals(List.of("slow", "broken"), quote.tagNames());
        assertEquals(7, quote.segmentIndex());
    }

    @Test
    @DisplayName("ранжирование по убыванию composite, равные сохраняют порядок, top-N обрезает")
    void mergeAndRank() {
        Signal a = signal("A", 0.5);
        Signal b = signal("B", 0.9);
        Signal c = signal("C", 0.5);
        Signal d = signal("D", 0.1);
        Signal e = signal("E", 0.5);

        List<Signal> ranked = signalDetector.mergeAndRank(List.of(List.of(a, b, c), List.of(d, e)), 12);
        assertEquals(List.of("B", "A", "C", "E", "D"), ranked.stream().map(Signal::location).toList());

        List<Signal> top = signalDetector.mergeAndRank(List.of(List.of(a, b, c), List.of(d, e)), 2);
        assertEquals(List.of("B", "A"), top.stream().map(Signal::location).toList());
    }

    private Signal signal(String location, double composite) {
        return new Signal(location, SourceType.SECTION, "Friction", 2, List.of("p1"), 1.0, 2.0, 1.0,
                composite, ConfidenceTier.EMERGING, List.of());
    }
}
