package ru.tigran.researchsignalengine.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.researchsignalengine.dto.AnalysisResponse;
import ru.tigran.researchsignalengine.dto.FrameworkAnalysisRequest;
import ru.tigran.researchsignalengine.dto.SentimentAnalysisRequest;
import ru.tigran.researchsignalengine.dto.TagAnalysisRequest;
import ru.tigran.researchsignalengine.model.AnalysisResult;
import ru.tigran.researchsignalengine.service.AnalysisResponseMapper;
import ru.tigran.researchsignalengine.service.SentimentAnalysisService;
import ru.tigran.researchsignalengine.service.TagAnalysisService;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Таблицы сопряжённости и сигналы по цитатам исследования")
public class AnalysisController {

    private final SentimentAnalysisService sentimentAnalysisService;
    private final TagAnalysisService tagAnalysisService;
    private final AnalysisResponseMapper responseMapper;

    public AnalysisController(
            SentimentAnalysisService sentimentAnalysisService,
            TagAnalysisService tagAnalysisService,
            AnalysisResponseMapper responseMapper
    ) {
        this.sentimentAnalysisService = sentimentAnalysisService;
        this.tagAnalysisService = tagAnalysisService;
        this.responseMapper = responseMapper;
    }

    /**
     * Sentiment analysis over sections and themes.
     *
     * @param request sections and themes with their quotes
     * @return matrices and ranked signals
     */
    @PostMapping("/sentiment")
    @Operation(
            summary = "Анализ по сентименту",
            description = "Строит матрицы экраны x сентимент и темы x сентимент, " +
                    "находит сигналы и возвращает top-N по composite score."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Матрицы и сигналы",
                    content = @Content(schema = @Schema(implementation = AnalysisResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Неверные параметры (intensity вне 1-3, повторяющиеся метки, topN вне 1-100)"
            )
    })
    public ResponseEntity<AnalysisResponse> analyzeSentiment(
            @Valid @RequestBody SentimentAnalysisRequest request
    ) {
        log.info("POST /api/v1/analysis/sentiment - sections: {}, themes: {}",
                request.sections().size(), request.themes().size());

        AnalysisResult result = sentimentAnalysisService.analyze(request);
        return ResponseEntity.ok(responseMapper.toResponse(result, null));
    }

    /**
     * Codebook tag analysis over sections and themes.
     *
     * @param request quotes, rows, groups and tag associations
     * @return matrices and ranked signals with the multi-group trade-off note
     */
    @PostMapping("/tags")
    @Operation(
            summary = "Анализ по группам тегов кодбука",
            description = "Та же математика, что и для сентимента, но столбцы - группы кодбука. " +
                    "Неподтверждённые предложенные теги учитываются с весом = confidence."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Матрицы и сигналы (пустой результат, если нет тегированных цитат)",
                    content = @Content(schema = @Schema(implementation = AnalysisResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Неверные параметры или неизвестная группа в фильтре"
            )
    })
    public ResponseEntity<AnalysisResponse> analyzeTags(
            @Valid @RequestBody TagAnalysisRequest request
    ) {
        log.info("POST /api/v1/analysis/tags - quotes: {}, groups: {}",
                request.quotes().size(), request.groups().size());

        AnalysisResult result = tagAnalysisService.analyze(request);
        return ResponseEntity.ok(responseMapper.toResponse(result, TagAnalysisService.TRADE_OFF_NOTE));
    }

    /**
     * One tag analysis per codebook framework, computed concurrently.
     *
     * @param request shared input and framework -> group names
     * @return framework name -> analysis
     */
    @PostMapping("/tags/frameworks")
    @Operation(
            summary = "Анализ по фреймворкам кодбука",
            description = "Запускает независимый анализ тегов для каждого фреймворка параллельно."
    )
    public ResponseEntity<Map<String, AnalysisResponse>> analyzeFrameworks(
            @Valid @RequestBody FrameworkAnalysisRequest request
    ) {
        log.info("POST /api/v1/analysis/tags/frameworks - frameworks: {}", request.frameworks().keySet());

        Map<String, AnalysisResponse> response = new LinkedHashMap<>();
        tagAnalysisService.analyzeFrameworks(request).forEach((framework, result) ->
                response.put(framework, responseMapper.toResponse(result, TagAnalysisService.TRADE_OFF_NOTE)));
        return ResponseEntity.ok(response);
    }
}
