package com.purchasingpower.codegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Neo4jProperties neo4j = new Neo4jProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PineconeProperties pinecone = new PineconeProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GeminiProperties gemini = new GeminiProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OllamaProperties ollama = new OllamaProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private IndexingProperties indexing = new IndexingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RetrievalProperties retrieval = new RetrievalProperties();
}
