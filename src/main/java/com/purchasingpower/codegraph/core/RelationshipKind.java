package com.purchasingpower.codegraph.core;

/**
 * Relationship (edge) types in the code graph.
 *
 * @since 1.0.0
 */
public enum RelationshipKind {
    CONTAINS,
    IMPORTS,
    INHERITS_FROM,
    CALLS,
    DECORATED_BY,
    HAS_METHOD,
    HAS_PARAM,
    RETURNS,
    DEFINES,
    DOCUMENTED_BY
}
