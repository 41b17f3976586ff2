package ru.tigran.researchsignalengine.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Контроллер для информации об API и эндпоинтах
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "Информация об API и доступных эндпоинтах")
public class ApiInfoController {

    @GetMapping("/endpoints")
    public ResponseEntity<ApiEndpointsResponse> getEndpoints() {
        return ResponseEntity.ok(new ApiEndpointsResponse(
                "Research Signal Engine API",
                "Stateless сервис для поиска сигналов в цитатах пользовательских исследований",
                "1.0.0",
                List.of(
                        new EndpointGroup(
                                "Анализ",
                                "Таблицы сопряжённости и ранжированные сигналы",
                                List.of(
                                        new ApiEndpoint("POST", "/api/v1/analysis/sentiment", "Анализ экранов и тем по сентименту"),
                                        new ApiEndpoint("POST", "/api/v1/analysis/tags", "Анализ экранов и тем по группам тегов кодбука"),
                                        new ApiEndpoint("POST", "/api/v1/analysis/tags/frameworks", "Параллельный анализ тегов по фреймворкам")
                                )
                        ),
                        new EndpointGroup(
                                "Документация",
                                "Доступ к документации API",
                                List.of(
                                        new ApiEndpoint("GET", "/swagger-ui.html", "Интерактивная документация Swagger UI"),
                                        new ApiEndpoint("GET", "/v3/api-docs", "OpenAPI документация в JSON формате"),
                                        new ApiEndpoint("GET", "/api/endpoints", "Получить список всех эндпоинтов")
                                )
                        )
                )
        ));
    }

    @Getter
    @RequiredArgsConstructor
    public static class ApiEndpointsResponse {
        private final String title;
        private final String description;
        private final String version;
        private final List<EndpointGroup> groups;
    }

    @Getter
    @RequiredArgsConstructor
    public static class EndpointGroup {
        private final String name;
        private final String description;
        private final List<ApiEndpoint> endpoints;
    }

    @Getter
    @RequiredArgsConstructor
    public static class ApiEndpoint {
        private final String method;
        private final String path;
        private final String description;
    }
}
