package ru.tigran.researchsignalengine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web-конфигурация: CORS для фронтенда отчёта и логирование запросов анализа
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${cors.allowed-origins:http://localhost:3000,http://localhost:8080}")
    private String allowedOrigins;

    @Value("${analysis.slow-request-ms:1000}")
    private long slowRequestMs;

    /**
     * Отчёт только читает метаданные и отправляет POST-запросы анализа
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = allowedOrigins.split(",");

        registry.addMapping("/api/v1/analysis/**")
                .allowedOrigins(origins)
                .allowedMethods("POST", "OPTIONS")
                .allowedHeaders("Content-Type");

        registry.addMapping("/api/endpoints")
                .allowedOrigins(origins)
                .allowedMethods("GET");

        registry.addMapping("/actuator/**")
                .allowedOrigins(origins)
                .allowedMethods("GET");
    }

    @Bean
    public AnalysisRequestLoggingFilter analysisRequestLoggingFilter() {
        return new AnalysisRequestLoggingFilter(slowRequestMs);
    }
}
