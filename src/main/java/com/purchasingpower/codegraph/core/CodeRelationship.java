package com.purchasingpower.codegraph.core;

import lombok.Builder;
import lombok.Value;

/**
 * Directed typed edge between two entities, referenced by name.
 *
 * <p>The source always names an entity of the file it was inferred from. The target
 * is resolved by name across the whole indexing run, so it may live in another file.
 * {@code targetKind} is a hint and may be null when the target kind is only known at upsert time.
 *
 * <p>Edges between entities of the same file (HAS_PARAM, RETURNS, DOCUMENTED_BY)
 * carry exact graph keys and skip name resolution.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class CodeRelationship {
    String sourceName;
    EntityKind sourceKind;
    String sourceModule;
    String targetName;
    EntityKind targetKind;
    RelationshipKind kind;
    int lineNumber;
    String sourceKey;
    String targetKey;

    public boolean hasExactKeys() {
        return sourceKey != null && targetKey != null;
    }
}
