package com.purchasingpower.codegraph.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for the chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "query is required")
    private String query;

    /**
     * Entity to look up directly. Blank or "unknown" skips the direct lookup.
     */
    private String entityName;

    /**
     * Chat session; turns are stored under it and feed the memory fallback.
     */
    private String sessionId;

    /**
     * Vector namespace to search.
     */
    private String repoId;
}
