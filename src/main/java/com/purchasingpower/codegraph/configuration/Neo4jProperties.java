package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class Neo4jProperties {

    @NotBlank
    private String uri = "bolt://localhost:7687";

    @NotBlank
    private String username = "neo4j";

    private String password = "";

    @Min(1)
    private int connectionTimeoutSeconds = 30;
}
