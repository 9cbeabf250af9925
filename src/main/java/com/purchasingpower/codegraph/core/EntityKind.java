package com.purchasingpower.codegraph.core;

import java.util.Arrays;

/**
 * Entity kinds in the code graph. The label is the Neo4j node label.
 *
 * @since 1.0.0
 */
public enum EntityKind {
    PACKAGE("Package"),
    FILE("File"),
    CLASS("Class"),
    FUNCTION("Function"),
    METHOD("Method"),
    PARAMETER("Parameter"),
    RETURN_TYPE("ReturnType"),
    DOCSTRING("Docstring");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD;
    }

    public static EntityKind fromLabel(String label) {
        return Arrays.stream(values())
                .filter(kind -> kind.label.equalsIgnoreCase(label) || kind.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity label: " + label));
    }
}
