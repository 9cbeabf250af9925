package com.purchasingpower.codegraph.knowledge;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Embedding of one chunk plus its flat metadata, ready for upsert.
 */
@Value
@Builder
public class ChunkVector {
    String id;
    List<Float> values;
    Map<String, String> metadata;
}
