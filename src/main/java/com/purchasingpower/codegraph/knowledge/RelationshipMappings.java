package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.core.RelationshipKind;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.purchasingpower.codegraph.core.RelationshipKind.CALLS;
import static com.purchasingpower.codegraph.core.RelationshipKind.CONTAINS;
import static com.purchasingpower.codegraph.core.RelationshipKind.DECORATED_BY;
import static com.purchasingpower.codegraph.core.RelationshipKind.DEFINES;
import static com.purchasingpower.codegraph.core.RelationshipKind.DOCUMENTED_BY;
import static com.purchasingpower.codegraph.core.RelationshipKind.HAS_METHOD;
import static com.purchasingpower.codegraph.core.RelationshipKind.HAS_PARAM;
import static com.purchasingpower.codegraph.core.RelationshipKind.IMPORTS;
import static com.purchasingpower.codegraph.core.RelationshipKind.INHERITS_FROM;
import static com.purchasingpower.codegraph.core.RelationshipKind.RETURNS;

/**
 * Which edge kinds each node label may have, and the Cypher used to expand an
 * entity's neighbourhood.
 */
public final class RelationshipMappings {

    /**
     * Edge kinds that count as structural dependencies when expanding an entity.
     */
    public static final String DEPENDENCY_TYPES = "IMPORTS|CALLS|INHERITS_FROM|CONTAINS";

    /**
     * Dependents (incoming), dependencies (outgoing) and parents (incoming CONTAINS) of
     * every node named {@code $name}, each as a name list plus count.
     */
    public static final String EXPANSION_QUERY = """
            MATCH (e {name: $name})
            OPTIONAL MATCH (dependent)-[:%1$s]->(e)
            WITH e, collect(DISTINCT dependent.name) AS dependents
            OPTIONAL MATCH (e)-[:%1$s]->(dependency)
            WITH e, dependents, collect(DISTINCT dependency.name) AS dependencies
            OPTIONAL MATCH (parent)-[:CONTAINS]->(e)
            WITH e, dependents, dependencies, collect(DISTINCT parent.name) AS parents
            RETURN e.name AS name,
                   labels(e)[0] AS type,
                   coalesce(e.docstring, e.content) AS docstring,
                   e.file_path AS filePath,
                   dependents, size(dependents) AS dependentCount,
                   dependencies, size(dependencies) AS dependencyCount,
                   parents, size(parents) AS parentCount
            """.formatted(DEPENDENCY_TYPES);

    private static final Map<String, Rule> RULES = Map.of(
            "Class", new Rule(
                    EnumSet.of(CONTAINS, INHERITS_FROM, DECORATED_BY, HAS_METHOD, DOCUMENTED_BY, IMPORTS),
                    EnumSet.of(INHERITS_FROM, CONTAINS, DEFINES, DECORATED_BY)),
            "Function", new Rule(
                    EnumSet.of(CALLS, DECORATED_BY, RETURNS, HAS_PARAM, DOCUMENTED_BY, IMPORTS),
                    EnumSet.of(CALLS, CONTAINS, DEFINES, DECORATED_BY)),
            "Method", new Rule(
                    EnumSet.of(CALLS, DECORATED_BY, RETURNS, HAS_PARAM, DOCUMENTED_BY, IMPORTS),
                    EnumSet.of(CALLS, HAS_METHOD, DEFINES, DECORATED_BY)),
            "Package", new Rule(
                    EnumSet.of(CONTAINS, IMPORTS),
                    EnumSet.of(IMPORTS, CONTAINS)),
            "File", new Rule(
                    EnumSet.of(CONTAINS, DEFINES, IMPORTS, DOCUMENTED_BY),
                    EnumSet.of(CONTAINS, IMPORTS)),
            "Parameter", new Rule(
                    EnumSet.noneOf(RelationshipKind.class),
                    EnumSet.of(HAS_PARAM)),
            "ReturnType", new Rule(
                    EnumSet.noneOf(RelationshipKind.class),
                    EnumSet.of(RETURNS)),
            "Docstring", new Rule(
                    EnumSet.noneOf(RelationshipKind.class),
                    EnumSet.of(DOCUMENTED_BY)),
            "Decorator", new Rule(
                    EnumSet.noneOf(RelationshipKind.class),
                    EnumSet.of(DECORATED_BY)));

    private RelationshipMappings() {
    }

    public static Set<RelationshipKind> outgoing(String label) {
        Rule rule = RULES.get(label);
        return rule == null ? Set.of() : Set.copyOf(rule.outgoing());
    }

    public static Set<RelationshipKind> incoming(String label) {
        Rule rule = RULES.get(label);
        return rule == null ? Set.of() : Set.copyOf(rule.incoming());
    }

    /**
     * True when {@code source -[kind]-> target} is allowed by both endpoint labels.
     */
    public static boolean validate(String sourceLabel, RelationshipKind kind, String targetLabel) {
        return outgoing(sourceLabel).contains(kind) && incoming(targetLabel).contains(kind);
    }

    private record Rule(Set<RelationshipKind> outgoing, Set<RelationshipKind> incoming) {
    }
}
