package com.purchasingpower.codegraph.search;

import lombok.Builder;
import lombok.Value;

/**
 * A candidate picked by the ranker. {@code confidence} is whatever the model reported.
 */
@Value
@Builder(toBuilder = true)
public class RankedEntity {
    String name;
    String type;
    Double confidence;
    String reason;
    boolean found;
    String message;
    EntityRelationships relationships;
}
