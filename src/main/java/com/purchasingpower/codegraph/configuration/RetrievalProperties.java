package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RetrievalProperties {

    @Min(1)
    private int topK = 10;

    @Min(1)
    private int entityLimit = 5;

    @Min(1)
    private int inventoryLimit = 200;

    @Min(0)
    private int memoryTurns = 6;

    private double minScore = 0.0;
}
