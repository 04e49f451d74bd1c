package com.stkbarbershop.bookingservice.configurations;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;

/**
 * CORS for the public booking form. The form is embedded on the shop's site,
 * so by default any origin may call the API.
 */
@Configuration
@Slf4j
public class CorsConfig implements WebMvcConfigurer {

    @Value("${cors.allowed-origins:*}")
    private String allowedOrigins;

    @Value("${cors.allowed-methods:*}")
    private String allowedMethods;

    @Value("${cors.allowed-headers:*}")
    private String allowedHeaders;

    @Value("${cors.allow-credentials:true}")
    private boolean allowCredentials;

    @Value("${cors.max-age:600}")
    private long maxAge;

    @PostConstruct
    public void logCorsConfiguration() {
        log.info("CORS Configuration Initialized:");
        log.info("  Allowed Origins: {}", allowedOrigins);
        log.info("  Allowed Methods: {}", allowedMethods);
        log.info("  Allow Credentials: {}", allowCredentials);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // Origin patterns rather than origins: "*" is not allowed together with credentials
        registry.addMapping("/**")
                .allowedOriginPatterns(parseCommaSeparated(allowedOrigins))
                .allowedMethods(parseCommaSeparated(allowedMethods))
                .allowedHeaders(parseCommaSeparated(allowedHeaders))
                .allowCredentials(allowCredentials)
                .maxAge(maxAge);
    }

    private String[] parseCommaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }
}
