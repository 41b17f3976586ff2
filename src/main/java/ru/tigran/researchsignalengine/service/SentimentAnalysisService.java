package ru.tigran.researchsignalengine.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.tigran.researchsignalengine.dto.QuoteInput;
import ru.tigran.researchsignalengine.dto.SectionInput;
import ru.tigran.researchsignalengine.dto.SentimentAnalysisRequest;
import ru.tigran.researchsignalengine.dto.ThemeInput;
import ru.tigran.researchsignalengine.model.AnalysisResult;
import ru.tigran.researchsignalengine.model.CellKey;
import ru.tigran.researchsignalengine.model.ContingencyMatrix;
import ru.tigran.researchsignalengine.model.QuoteRecord;
import ru.tigran.researchsignalengine.model.Sentiment;
import ru.tigran.researchsignalengine.model.Signal;
import ru.tigran.researchsignalengine.model.SourceType;
import ru.tigran.researchsignalengine.util.ParticipantIds;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentiment analysis: sections and themes as rows, the fixed sentiment vocabulary as columns.
 * Each quote with a sentiment contributes once, with full weight, to its section or theme.
 */
@Slf4j
@Service
public class SentimentAnalysisService {

    /**
     * Quote placed under a section or theme label.
     */
    private record LocatedQuote(String location, QuoteInput quote) {
        String sentimentValue() {
            return quote.sentiment() != null ? quote.sentiment().getValue() : null;
        }
    }

    private final MatrixBuilder matrixBuilder;
    private final SignalDetector signalDetector;
    private final int defaultTopN;
    private final Counter analysisCounter;
    private final Timer analysisTimer;

    public SentimentAnalysisService(
            MatrixBuilder matrixBuilder,
            SignalDetector signalDetector,
            MeterRegistry meterRegistry,
            @Value("${analysis.default-top-n:12}") int defaultTopN
    ) {
        this.matrixBuilder = matrixBuilder;
        this.signalDetector = signalDetector;
        this.defaultTopN = defaultTopN;
        this.analysisCounter = Counter.builder("analysis.runs")
                .tag("kind", "sentiment")
                .description("Total sentiment analyses computed")
                .register(meterRegistry);
        this.analysisTimer = Timer.builder("analysis.time")
                .tag("kind", "sentiment")
                .description("Time to compute a sentiment analysis")
                .register(meterRegistry);
    }

    /**
     * Builds section and theme matrices, detects signals in both and ranks them together.
     *
     * @param request sections and themes with their quotes
     * @return analysis result with the sentiment vocabulary as categories
     */
    public AnalysisResult analyze(SentimentAnalysisRequest request) {
        analysisCounter.increment();
        return analysisTimer.record(() -> executeAnalysis(request));
    }

    private AnalysisResult executeAnalysis(SentimentAnalysisRequest request) {
        List<String> columns = Sentiment.labels();

        List<SectionInput> sections = request.sections().stream()
                .sorted(Comparator.comparingInt(SectionInput::displayOrder))
                .toList();
        List<String> sectionLabels = sections.stream().map(SectionInput::label).toList();
        List<String> themeLabels = request.themes().stream().map(ThemeInput::label).toList();

        List<LocatedQuote> sectionQuotes = new ArrayList<>();
        for (SectionInput section : sections) {
            section.quotes().forEach(q -> sectionQuotes.add(new LocatedQuote(section.label(), q)));
        }
        List<LocatedQuote> themeQuotes = new ArrayList<>();
        for (ThemeInput theme : request.themes()) {
            theme.quotes().forEach(q -> themeQuotes.add(new LocatedQuote(theme.label(), q)));
        }

        log.info("Starting sentiment analysis: {} sections, {} themes, {} quotes",
                sectionLabels.size(), themeLabels.size(), sectionQuotes.size() + themeQuotes.size());

        ContingencyMatrix sectionMatrix = buildMatrix(sectionQuotes, sectionLabels, columns);
        ContingencyMatrix themeMatrix = buildMatrix(themeQuotes, themeLabels, columns);

        int totalParticipants = request.totalParticipants() != null
                ? request.totalParticipants()
                : countParticipants(sectionQuotes, themeQuotes);

        List<Signal> sectionSignals = signalDetector.detect(
                sectionMatrix, SourceType.SECTION, totalParticipants, buildQuoteLookup(sectionQuotes));
        List<Signal> themeSignals = signalDetector.detect(
                themeMatrix, SourceType.THEME, totalParticipants, buildQuoteLookup(themeQuotes));

        int topN = request.topN() != null ? request.topN() : defaultTopN;
        List<Signal> signals = signalDetector.mergeAndRank(List.of(sectionSignals, themeSignals), topN);

        log.info("Sentiment analysis complete: {} signals ({} candidates), {} participants",
                signals.size(), sectionSignals.size() + themeSignals.size(), totalParticipants);

        return new AnalysisResult(sectionMatrix, themeMatrix, signals, totalParticipants, columns);
    }

    private ContingencyMatrix buildMatrix(List<LocatedQuote> quotes, List<String> rowLabels, List<String> columns) {
        return matrixBuilder.buildFixed(
                quotes,
                LocatedQuote::location,
                LocatedQuote::sentimentValue,
                lq -> lq.quote().participantId(),
                lq -> lq.quote().intensity(),
                rowLabels,
                columns
        );
    }

    /**
     * Maps "location x sentiment" cells to their quotes. Quotes without sentiment are skipped.
     */
    private Map<CellKey, List<QuoteRecord>> buildQuoteLookup(List<LocatedQuote> quotes) {
        Map<CellKey, List<QuoteRecord>> lookup = new LinkedHashMap<>();
        for (LocatedQuote located : quotes) {
            String sentiment = located.sentimentValue();
            if (sentiment == null) {
                continue;
            }
            QuoteInput quote = located.quote();
            lookup.computeIfAbsent(CellKey.of(located.location(), sentiment), k -> new ArrayList<>())
                    .add(new QuoteRecord(
                            quote.text(),
                            quote.participantId(),
                            quote.sessionId(),
                            quote.startSeconds(),
                            quote.intensity()
                    ));
        }
        return lookup;
    }

    private int countParticipants(List<LocatedQuote> sectionQuotes, List<LocatedQuote> themeQuotes) {
        List<String> ids = new ArrayList<>();
        sectionQuotes.forEach(lq -> ids.add(lq.quote().participantId()));
        themeQuotes.forEach(lq -> ids.add(lq.quote().participantId()));
        return ParticipantIds.countParticipants(ids);
    }
}
