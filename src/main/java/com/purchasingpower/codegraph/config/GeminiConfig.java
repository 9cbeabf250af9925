package com.purchasingpower.codegraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Temperatures and retry behaviour for Gemini calls.
 *
 * <p>Properties are loaded from the {@code app.gemini} namespace in application.yml:
 * <pre>
 * app:
 *   gemini:
 *     default-temperature: 0.7
 *     json-temperature: 0.1
 *     retry:
 *       max-attempts: 3
 *       initial-backoff-seconds: 2
 * </pre>
 */
@ConfigurationProperties(prefix = "app.gemini")
@Data
public class GeminiConfig {

    private double defaultTemperature = 0.7;

    /**
     * Temperature for strict-JSON ranking requests.
     */
    private double jsonTemperature = 0.1;

    private RetryConfig retry = new RetryConfig();

    @Data
    public static class RetryConfig {

        private int maxAttempts = 3;

        private long initialBackoffSeconds = 2;

        private long maxBackoffSeconds = 20;

        /**
         * HTTP status codes that trigger a retry.
         */
        private List<Integer> retryableStatusCodes = List.of(429, 500, 502, 503, 504);
    }
}
