package com.purchasingpower.codegraph.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: synthesis
 * version: 1.0
 * temperature: 0.2
 * systemPrompt: |
 *   You are a software engineering tutor...
 * userPrompt: |
 *   Question: {{{query}}}
 * </pre>
 *
 * @see com.purchasingpower.codegraph.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private double temperature;
    private String systemPrompt;
    private String userPrompt;
}
