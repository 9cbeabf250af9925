package com.purchasingpower.codegraph.model;

/**
 * External services called by the code graph, for unified logging.
 *
 * @see com.purchasingpower.codegraph.util.ExternalCallLogger
 */
public enum ServiceType {
    NEO4J("🟢", "Neo4j"),
    PINECONE("🔵", "Pinecone"),
    GEMINI("🔴", "Gemini"),
    OLLAMA("🟣", "Ollama"),
    GIT("🔷", "Git");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
