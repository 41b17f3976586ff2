package ru.tigran.researchsignalengine.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Логирование запросов анализа: вид анализа, размер тела запроса, статус и длительность.
 * Остальные запросы (actuator, swagger, /api/endpoints) не логируются.
 */
@Slf4j
public class AnalysisRequestLoggingFilter extends OncePerRequestFilter {

    static final String ANALYSIS_PATH_PREFIX = "/api/v1/analysis/";

    private final long slowThresholdMs;

    public AnalysisRequestLoggingFilter(long slowThresholdMs) {
        this.slowThresholdMs = slowThresholdMs;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(ANALYSIS_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        long startTime = System.currentTimeMillis();
        String kind = analysisKind(request.getRequestURI());
        long bodyBytes = request.getContentLengthLong();

        try {
            filterChain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            int status = response.getStatus();

            if (status >= 400) {
                log.warn("Analysis {} rejected - Status: {} - Body: {} bytes - Duration: {}ms",
                        kind, status, bodyBytes, duration);
            } else if (duration >= slowThresholdMs) {
                log.info("Analysis {} - Body: {} bytes - Duration: {}ms (slow, threshold {}ms)",
                        kind, bodyBytes, duration, slowThresholdMs);
            } else {
                log.debug("Analysis {} - Body: {} bytes - Duration: {}ms", kind, bodyBytes, duration);
            }
        }
    }

    /**
     * "/api/v1/analysis/tags/frameworks" -> "tags/frameworks"
     */
    static String analysisKind(String uri) {
        if (uri == null || !uri.startsWith(ANALYSIS_PATH_PREFIX)) {
            return "unknown";
        }
        String kind = uri.substring(ANALYSIS_PATH_PREFIX.length());
        if (kind.endsWith("/")) {
            kind = kind.substring(0, kind.length() - 1);
        }
        return kind.isEmpty() ? "unknown" : kind;
    }
}
