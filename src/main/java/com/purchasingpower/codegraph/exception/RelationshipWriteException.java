package com.purchasingpower.codegraph.exception;

import com.purchasingpower.codegraph.core.CodeRelationship;
import lombok.Getter;

/**
 * One edge could not be written. Skipped and counted by the upsert engine.
 */
@Getter
public class RelationshipWriteException extends CodeGraphException {

    private final transient CodeRelationship relationship;

    public RelationshipWriteException(CodeRelationship relationship, String detail) {
        super(describe(relationship) + ": " + detail);
        this.relationship = relationship;
    }

    public RelationshipWriteException(CodeRelationship relationship, Throwable cause) {
        super(describe(relationship) + ": " + cause.getMessage(), cause);
        this.relationship = relationship;
    }

    private static String describe(CodeRelationship rel) {
        return String.format("(%s)-[%s]->(%s)", rel.getSourceName(), rel.getKind(), rel.getTargetName());
    }
}
