package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GeminiProperties {

    private String apiKey;

    @NotBlank
    private String chatModel = "gemini-1.5-flash";

    @NotBlank
    private String baseUrl = "https://generativelanguage.googleapis.com";

    @NotBlank
    private String apiVersion = "v1beta";

    private int responseTimeoutSeconds = 60;
}
