package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String embeddingModel = "mxbai-embed-large";

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 3;
}
