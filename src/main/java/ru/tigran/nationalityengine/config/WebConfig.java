package ru.tigran.nationalityengine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Конфигурация для web (CORS, логирование запросов)
 */
@Slf4j
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final long SLOW_REQUEST_MS = 1000;

    @Value("${cors.allowed-origins:http://localhost:3000,http://localhost:8080}")
    private String allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(allowedOrigins.split(","))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600)
                .exposedHeaders("Retry-After");
    }

    /**
     * Логирование всех запросов: ошибки в warn, медленные в info, остальные в debug
     */
    @Bean
    public OncePerRequestFilter requestLoggingFilter() {
        return new OncePerRequestFilter() {
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

                    if (status >= 400) {
                        log.warn("Request: {} {} - Status: {} - Duration: {}ms - Query: {}",
                            request.getMethod(), request.getRequestURI(), status, duration, request.getQueryString());
                    } else if (duration > SLOW_REQUEST_MS) {
                        log.info("Request: {} {} - Status: {} - Duration: {}ms (slow)",
                            request.getMethod(), request.getRequestURI(), status, duration);
                    } else {
                        log.debug("Request: {} {} - Status: {} - Duration: {}ms",
                            request.getMethod(), request.getRequestURI(), status, duration);
                    }
                }
            }
        };
    }
}
