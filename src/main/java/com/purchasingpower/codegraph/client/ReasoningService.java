package com.purchasingpower.codegraph.client;

/**
 * Text completion used for entity ranking and answer synthesis.
 *
 * <p>Implementations throw an unchecked exception when the model cannot be reached;
 * callers decide how to degrade.
 *
 * @since 1.0.0
 */
public interface ReasoningService {

    /**
     * Complete with the provider's default temperature.
     *
     * @param systemPrompt instructions for the model, may be blank
     * @param userPrompt the request itself
     * @return the model's text response
     */
    String complete(String systemPrompt, String userPrompt);

    String complete(String systemPrompt, String userPrompt, double temperature);
}
