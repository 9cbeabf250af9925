package com.purchasingpower.codegraph.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.config.GeminiConfig;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.GeminiProperties;
import com.purchasingpower.codegraph.exception.CodeGraphException;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gemini {@code generateContent} client backing {@link ReasoningService}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiClient implements ReasoningService {

    private final AppProperties props;
    private final GeminiConfig geminiConfig;
    private final ObjectMapper objectMapper;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        GeminiProperties gemini = props.getGemini();
        if (gemini.getApiKey() == null || gemini.getApiKey().isBlank()) {
            log.warn("⚠️ app.gemini.api-key is not set, reasoning calls will fail and callers will degrade");
        }
        this.geminiWebClient = WebClient.builder()
                .baseUrl(gemini.getBaseUrl())
                .defaultHeader("x-goog-api-key", gemini.getApiKey() == null ? "" : gemini.getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        return complete(systemPrompt, userPrompt, geminiConfig.getDefaultTemperature());
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, double temperature) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", log);
        String model = props.getGemini().getChatModel();

        callCtx.logRequest("Generating text",
                "Model", model,
                "Temperature", temperature,
                "Prompt Length", userPrompt.length() + " chars",
                "Prompt", ExternalCallLogger.truncate(userPrompt, 500));

        try {
            String json = geminiWebClient.post()
                    .uri(getApiUrl(model, "generateContent"))
                    .bodyValue(buildBody(systemPrompt, userPrompt, temperature))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(props.getGemini().getResponseTimeoutSeconds()))
                    .retryWhen(buildRetrySpec())
                    .block();

            String response = extractText(json);

            JsonNode usage = objectMapper.readTree(json).path("usageMetadata");
            callCtx.logResponse("Text generated",
                    "Tokens", String.format("%d in + %d out",
                            usage.path("promptTokenCount").asInt(0), usage.path("candidatesTokenCount").asInt(0)),
                    "Response", ExternalCallLogger.truncate(response, 500));
            return response;

        } catch (WebClientResponseException e) {
            callCtx.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            throw new CodeGraphException("Gemini call failed with status " + e.getStatusCode().value(), e);
        } catch (CodeGraphException e) {
            callCtx.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            callCtx.logError("Unexpected error: " + e.getMessage(), e);
            throw new CodeGraphException("Gemini call failed: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> buildBody(String systemPrompt, String userPrompt, double temperature) {
        Map<String, Object> body = new HashMap<>();
        body.put("contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", userPrompt)))));
        body.put("generationConfig", Map.of("temperature", temperature));
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemPrompt))));
        }
        return body;
    }

    String extractText(String rawJson) throws Exception {
        JsonNode candidates = objectMapper.readTree(rawJson).path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            throw new CodeGraphException("Gemini returned no candidates");
        }
        JsonNode parts = candidates.get(0).path("content").path("parts");
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    private String getApiUrl(String model, String action) {
        return String.format("/%s/models/%s:%s", props.getGemini().getApiVersion(), model, action);
    }

    private Retry buildRetrySpec() {
        GeminiConfig.RetryConfig retry = geminiConfig.getRetry();
        return Retry.backoff(retry.getMaxAttempts(), Duration.ofSeconds(retry.getInitialBackoffSeconds()))
                .maxBackoff(Duration.ofSeconds(retry.getMaxBackoffSeconds()))
                .filter(this::isRetryable)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        List<Integer> codes = geminiConfig.getRetry().getRetryableStatusCodes();
        if (codes == null) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return codes.contains(webEx.getStatusCode().value());
    }
}
