package com.purchasingpower.codegraph.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class EntityNotFoundException extends CodeGraphException {

    private final String entityName;
    private final List<String> suggestions;

    public EntityNotFoundException(String entityName, List<String> suggestions) {
        super(buildMessage(entityName, suggestions));
        this.entityName = entityName;
        this.suggestions = List.copyOf(suggestions);
    }

    private static String buildMessage(String entityName, List<String> suggestions) {
        if (suggestions.isEmpty()) {
            return "Entity not found: " + entityName;
        }
        return "Entity not found: " + entityName + ". Did you mean: " + String.join(", ", suggestions) + "?";
    }
}
