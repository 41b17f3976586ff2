package ru.tigran.researchsignalengine.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.tigran.researchsignalengine.dto.CodebookGroupInput;
import ru.tigran.researchsignalengine.dto.FrameworkAnalysisRequest;
import ru.tigran.researchsignalengine.dto.TagAnalysisRequest;
import ru.tigran.researchsignalengine.dto.TaggedQuoteInput;
import ru.tigran.researchsignalengine.exception.AnalysisExecutionException;
import ru.tigran.researchsignalengine.exception.ApplicationException;
import ru.tigran.researchsignalengine.exception.ErrorCode;
import ru.tigran.researchsignalengine.exception.ValidationException;
import ru.tigran.researchsignalengine.model.AnalysisResult;
import ru.tigran.researchsignalengine.model.ContingencyMatrix;
import ru.tigran.researchsignalengine.model.Signal;
import ru.tigran.researchsignalengine.model.SourceType;
import ru.tigran.researchsignalengine.util.ParticipantIds;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Codebook tag analysis: sections and themes as rows, codebook groups as columns.
 *
 * Same maths as sentiment analysis. A quote counts in a group column if it carries any
 * tag of that group; quotes tagged in several groups count in each of them, which
 * inflates grand totals relative to the number of unique quotes.
 */
@Slf4j
@Service
public class TagAnalysisService {

    public static final String UNCATEGORISED_GROUP_NAME = "Uncategorised";

    public static final String TRADE_OFF_NOTE =
            "Quotes tagged with codes from multiple groups count in each group column."
                    + " This inflates grandTotal relative to the number of unique quotes."
                    + " Signal strengths are internally consistent within this analysis;"
                    + " compare them to each other, not against sentiment-based analysis.";

    private final TagContributionResolver contributionResolver;
    private final MatrixBuilder matrixBuilder;
    private final SignalDetector signalDetector;
    private final Executor analysisExecutor;
    private final int defaultTopN;
    private final Counter analysisCounter;
    private final Timer analysisTimer;

    public TagAnalysisService(
            TagContributionResolver contributionResolver,
            MatrixBuilder matrixBuilder,
            SignalDetector signalDetector,
            @Qualifier("analysisExecutor") Executor analysisExecutor,
            MeterRegistry meterRegistry,
            @Value("${analysis.default-top-n:12}") int defaultTopN
    ) {
        this.contributionResolver = contributionResolver;
        this.matrixBuilder = matrixBuilder;
        this.signalDetector = signalDetector;
        this.analysisExecutor = analysisExecutor;
        this.defaultTopN = defaultTopN;
        this.analysisCounter = Counter.builder("analysis.runs")
                .tag("kind", "tags")
                .description("Total tag analyses computed")
                .register(meterRegistry);
        this.analysisTimer = Timer.builder("analysis.time")
                .tag("kind", "tags")
                .description("Time to compute a tag analysis")
                .register(meterRegistry);
    }

    /**
     * Computes tag-based signal analysis.
     *
     * @param request quotes, rows, codebook groups and tag associations
     * @return analysis result; empty when there are no active groups, no quotes or no tagged quotes
     * @throws ValidationException if the group filter names an unknown group
     */
    public AnalysisResult analyze(TagAnalysisRequest request) {
        analysisCounter.increment();
        return analysisTimer.record(() -> executeAnalysis(request));
    }

    /**
     * Runs one independent tag analysis per framework on the analysis thread pool.
     * Each framework's group list replaces the request's group filter.
     *
     * @param request shared analysis input and framework -> group names
     * @return framework name -> result, in request order
     */
    public Map<String, AnalysisResult> analyzeFrameworks(FrameworkAnalysisRequest request) {
        log.info("Starting framework analysis for {} frameworks", request.frameworks().size());

        Map<String, CompletableFuture<AnalysisResult>> futures = new LinkedHashMap<>();
        request.frameworks().forEach((framework, groups) -> futures.put(
                framework,
                CompletableFuture.supplyAsync(
                        () -> analyze(request.analysis().withGroupFilter(groups)),
                        analysisExecutor
                )
        ));

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ApplicationException applicationException) {
                throw applicationException;
            }
            throw new AnalysisExecutionException(
                    "Framework analysis failed: " + cause.getMessage(),
                    ErrorCode.ANALYSIS_FAILED.getCode(),
                    cause
            );
        }

        Map<String, AnalysisResult> results = new LinkedHashMap<>();
        futures.forEach((framework, future) -> results.put(framework, future.join()));
        return results;
    }

    private AnalysisResult executeAnalysis(TagAnalysisRequest request) {
        List<CodebookGroupInput> activeGroups = resolveActiveGroups(request.groups(), request.groupFilter());
        if (activeGroups.isEmpty() || request.quotes().isEmpty()) {
            log.info("Tag analysis skipped: {} active groups, {} quotes", activeGroups.size(), request.quotes().size());
            return AnalysisResult.empty();
        }

        TagContributionResolver.ResolvedContributions resolved = contributionResolver.resolve(
                request.quotes(),
                activeGroups,
                request.acceptedTags(),
                request.proposedTags()
        );
        if (resolved.isEmpty()) {
            log.info("Tag analysis skipped: no quotes tagged in {} active groups", activeGroups.size());
            return AnalysisResult.empty();
        }

        List<String> columns = activeGroups.stream().map(CodebookGroupInput::name).toList();
        log.info("Starting tag analysis: {} groups, {} tagged quotes", columns.size(), resolved.taggedQuoteCount());

        ContingencyMatrix sectionMatrix = matrixBuilder.build(
                resolved.sectionContributions(), request.sectionLabels(), columns);
        ContingencyMatrix themeMatrix = matrixBuilder.build(
                resolved.themeContributions(), request.themeLabels(), columns);

        int totalParticipants = ParticipantIds.countParticipants(
                request.quotes().stream().map(TaggedQuoteInput::participantId).toList());

        List<Signal> sectionSignals = signalDetector.detect(
                sectionMatrix, SourceType.SECTION, totalParticipants, resolved.sectionQuoteLookup());
        List<Signal> themeSignals = signalDetector.detect(
                themeMatrix, SourceType.THEME, totalParticipants, resolved.themeQuoteLookup());

        int topN = request.topN() != null ? request.topN() : defaultTopN;
        List<Signal> signals = signalDetector.mergeAndRank(List.of(sectionSignals, themeSignals), topN);

        log.info("Tag analysis complete: {} signals ({} candidates), {} participants",
                signals.size(), sectionSignals.size() + themeSignals.size(), totalParticipants);

        return new AnalysisResult(sectionMatrix, themeMatrix, signals, totalParticipants, columns);
    }

    /**
     * Without a filter: every group except Uncategorised. With a filter: the named groups,
     * in codebook display order.
     */
    private List<CodebookGroupInput> resolveActiveGroups(List<CodebookGroupInput> groups, List<String> filter) {
        if (filter == null || filter.isEmpty()) {
            return groups.stream()
                    .filter(group -> !UNCATEGORISED_GROUP_NAME.equals(group.name()))
                    .toList();
        }

        Map<String, CodebookGroupInput> byName = groups.stream()
                .collect(Collectors.toMap(CodebookGroupInput::name, Function.identity(), (a, b) -> a));
        for (String name : filter) {
            if (!byName.containsKey(name)) {
                throw new ValidationException(
                        "Unknown codebook group in filter: " + name,
                        ErrorCode.UNKNOWN_GROUP.getCode()
                );
            }
        }
        return groups.stream()
                .filter(group -> filter.contains(group.name()))
                .toList();
    }
}
