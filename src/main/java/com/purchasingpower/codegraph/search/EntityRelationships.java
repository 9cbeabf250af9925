package com.purchasingpower.codegraph.search;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An entity's neighbourhood: who depends on it, what it depends on, and what contains it.
 */
@Value
@Builder
public class EntityRelationships {
    String name;
    String type;
    String docstring;
    String filePath;
    @Singular List<String> dependents;
    @Singular List<String> dependencies;
    @Singular List<String> parents;
    int dependentCount;
    int dependencyCount;
    int parentCount;

    public boolean isIsolated() {
        return dependentCount == 0 && dependencyCount == 0 && parentCount == 0;
    }

    /**
     * Maps one row of {@link com.purchasingpower.codegraph.knowledge.RelationshipMappings#EXPANSION_QUERY}.
     */
    public static EntityRelationships fromRow(Map<String, Object> row) {
        List<String> dependents = names(row.get("dependents"));
        List<String> dependencies = names(row.get("dependencies"));
        List<String> parents = names(row.get("parents"));
        return EntityRelationships.builder()
                .name(string(row.get("name")))
                .type(string(row.get("type")))
                .docstring(string(row.get("docstring")))
                .filePath(string(row.get("filePath")))
                .dependents(dependents)
                .dependencies(dependencies)
                .parents(parents)
                .dependentCount(count(row.get("dependentCount"), dependents))
                .dependencyCount(count(row.get("dependencyCount"), dependencies))
                .parentCount(count(row.get("parentCount"), parents))
                .build();
    }

    public static EntityRelationships isolated(String name, String type) {
        return EntityRelationships.builder().name(name).type(type).build();
    }

    private static List<String> names(Object value) {
        List<String> names = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    names.add(item.toString());
                }
            }
        }
        return names;
    }

    private static int count(Object value, List<String> fallback) {
        return value instanceof Number number ? number.intValue() : fallback.size();
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }
}
