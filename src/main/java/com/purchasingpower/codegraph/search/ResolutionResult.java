package com.purchasingpower.codegraph.search;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a ranking lookup. Degraded lookups are still successful, with no
 * entities and a message saying why.
 */
@Value
@Builder(toBuilder = true)
public class ResolutionResult {
    boolean success;
    @Singular List<RankedEntity> entities;
    String message;

    public List<RankedEntity> getFoundEntities() {
        return entities.stream().filter(RankedEntity::isFound).toList();
    }

    public boolean hasFoundEntities() {
        return entities.stream().anyMatch(RankedEntity::isFound);
    }

    public static ResolutionResult degraded(String message) {
        return ResolutionResult.builder().success(true).message(message).build();
    }
}
