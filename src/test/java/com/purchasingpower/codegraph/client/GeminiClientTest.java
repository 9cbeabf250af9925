package com.purchasingpower.codegraph.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.config.GeminiConfig;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.exception.CodeGraphException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Gemini client")
class GeminiClientTest {

    private AppProperties props;
    private GeminiClient geminiClient;

    @BeforeEach
    void setUp() {
        props = new AppProperties();
        props.getGemini().setApiKey(System.getenv("GEMINI_API_KEY"));
        geminiClient = new GeminiClient(props, new GeminiConfig(), new ObjectMapper());
        geminiClient.init();
    }

    @Test
    @DisplayName("Should join the text parts of the first candidate")
    void shouldExtractText() throws Exception {
        String json = """
                {"candidates": [{"content": {"parts": [{"text": "Hello, "}, {"text": "world"}]}}],
                 "usageMetadata": {"promptTokenCount": 3, "candidatesTokenCount": 2}}
                """;

        assertThat(geminiClient.extractText(json)).isEqualTo("Hello, world");
    }

    @Test
    @DisplayName("Should fail when the response has no candidates")
    void shouldFailWithoutCandidates() {
        assertThatThrownBy(() -> geminiClient.extractText("{\"candidates\": []}"))
                .isInstanceOf(CodeGraphException.class)
                .hasMessage("Gemini returned no candidates");
    }

    @Test
    @DisplayName("Should retry only on configured HTTP status codes")
    void shouldRetryOnConfiguredStatuses() {
        assertThat(geminiClient.isRetryable(httpError(429))).isTrue();
        assertThat(geminiClient.isRetryable(httpError(503))).isTrue();
        assertThat(geminiClient.isRetryable(httpError(400))).isFalse();
        assertThat(geminiClient.isRetryable(new IllegalStateException("boom"))).isFalse();
    }

    /**
     * Hits the real API. Requires GEMINI_API_KEY.
     */
    @Test
    @EnabledIfEnvironmentVariable(named = "GEMINI_API_KEY", matches = ".+")
    @DisplayName("Should complete a prompt against the live API")
    void shouldCompleteLive() {
        // When
        String response = geminiClient.complete("Answer with one word.", "What color is the sky on a clear day?", 0.1);

        // Then
        System.out.println("Gemini response: " + response);
        assertThat(response).isNotBlank();
    }

    private static WebClientResponseException httpError(int status) {
        return WebClientResponseException.create(status, "status " + status, HttpHeaders.EMPTY,
                new byte[0], StandardCharsets.UTF_8);
    }
}
