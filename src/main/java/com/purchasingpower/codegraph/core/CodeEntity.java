package com.purchasingpower.codegraph.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * One extracted code construct.
 *
 * <p>Entities are immutable. Re-indexing the same file produces entities with the
 * same {@link #identity()}, and the graph layer creates-or-matches on that identity.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class CodeEntity {
    EntityKind kind;
    String name;
    String qualifiedModule;
    String filePath;
    int lineNumber;
    String docstring;
    @Singular
    List<String> decorators;
    @Singular("base")
    List<String> bases;
    @Singular
    List<String> parameters;
    String returnType;
    boolean async;
    String parentClass; // Methods only
    String owner; // owning function or class of a Parameter, ReturnType or Docstring, e.g. "Base.save"
    String docstringScope; // module, class or function
    @Singular
    Set<String> calls;

    public EntityIdentity identity() {
        return new EntityIdentity(name, qualifiedModule, kind);
    }

    /**
     * Graph key for this entity. Methods include their class so that
     * same-named methods of sibling classes stay distinct nodes.
     */
    public String graphKey() {
        return switch (kind) {
            case PACKAGE, DOCSTRING -> name;
            case FILE -> filePath;
            case RETURN_TYPE -> "type:" + name;
            case METHOD -> qualifiedModule + "." + parentClass + "." + name;
            case PARAMETER -> qualifiedModule + "." + owner + ":" + name;
            default -> qualifiedModule + "." + name;
        };
    }
}
