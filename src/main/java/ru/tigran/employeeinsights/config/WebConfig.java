package ru.tigran.employeeinsights.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.io.IOException;

/**
 * Конфигурация для web (CORS, журнал запросов)
 */
@Slf4j
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${cors.allowed-origins:http://localhost:3000,http://localhost:5173}")
    private String allowedOrigins;

    /**
     * CORS для фронтенда дашборда
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = allowedOrigins.split(",");

        registry.addMapping("/api/**")
                .allowedOrigins(origins)
                .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);

        registry.addMapping("/actuator/**")
                .allowedOrigins(origins)
                .allowedMethods("GET")
                .allowedHeaders("*")
                .maxAge(3600);
    }

    @Bean
    public OncePerRequestFilter requestLoggingFilter(
            @Value("${app.web.slow-request-ms:1000}") long slowRequestMs,
            @Value("${app.web.slow-import-ms:30000}") long slowImportMs
    ) {
        return new RequestLoggingFilter(slowRequestMs, slowImportMs);
    }

    /**
     * Ошибки пишутся на warn, медленные запросы на info, остальное на debug.
     * Импорт данных занимает больше времени, поэтому для /api/v1/data/ свой порог.
     * Запросы к /actuator/ (health, prometheus) не логируются.
     */
    static class RequestLoggingFilter extends OncePerRequestFilter {

        private static final String IMPORT_PREFIX = "/api/v1/data/";
        private static final String ACTUATOR_PREFIX = "/actuator/";

        private final long slowRequestMs;
        private final long slowImportMs;

        RequestLoggingFilter(long slowRequestMs, long slowImportMs) {
            this.slowRequestMs = slowRequestMs;
            this.slowImportMs = slowImportMs;
        }

        @Override
        protected boolean shouldNotFilter(HttpServletRequest request) {
            return request.getRequestURI().startsWith(ACTUATOR_PREFIX);
        }

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain
        ) throws ServletException, IOException {
            long startTime = System.currentTimeMillis();
            try {
                filterChain.doFilter(request, response);
            } finally {
                long duration = System.currentTimeMillis() - startTime;
                int status = response.getStatus();
                String uri = request.getRequestURI();
                long threshold = uri.startsWith(IMPORT_PREFIX) ? slowImportMs : slowRequestMs;

                if (status >= 400) {
                    log.warn("{} {} -> {} in {}ms, query: {}",
                            request.getMethod(), uri, status, duration, request.getQueryString());
                } else if (duration > threshold) {
                    log.info("{} {} -> {} in {}ms (slow, threshold {}ms)",
                            request.getMethod(), uri, status, duration, threshold);
                } else {
                    log.debug("{} {} -> {} in {}ms", request.getMethod(), uri, status, duration);
                }
            }
        }
    }
}
