package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.core.CodeEntity;
import com.purchasingpower.codegraph.core.CodeRelationship;
import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.core.FileExtraction;
import com.purchasingpower.codegraph.core.RelationshipKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers typed edges from the entities of one file.
 *
 * <p>Sources always carry the exact graph key of a local entity. Targets of
 * INHERITS_FROM, DECORATED_BY and IMPORTS are names only and get resolved across
 * the whole indexing run by {@link GraphUpsertEngine}.
 *
 * <p>CALLS is an over-approximation: a callee counts when its name appears as a call
 * anywhere in the file outside its own definition line, and the edge goes to every
 * other local callable whose collected call names contain it.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class RelationshipInferencer {

    private static final Set<EntityKind> DECORATABLE = Set.of(EntityKind.CLASS, EntityKind.FUNCTION, EntityKind.METHOD);

    public List<CodeRelationship> infer(FileExtraction file) {
        List<CodeRelationship> relationships = new ArrayList<>();
        List<CodeEntity> entities = file.getEntities();
        String[] lines = file.getContent() == null ? new String[0] : file.getContent().split("\n", -1);

        for (CodeEntity entity : entities) {
            switch (entity.getKind()) {
                case CLASS -> {
                    inheritance(entity, relationships);
                    nestedClass(entity, entities, relationships);
                }
                case PARAMETER -> ownedBy(entity, entities, RelationshipKind.HAS_PARAM, relationships);
                case RETURN_TYPE -> ownedBy(entity, entities, RelationshipKind.RETURNS, relationships);
                case DOCSTRING -> documentedBy(entity, file, entities, relationships);
                default -> {
                    // no kind-specific edges
                }
            }
            if (DECORATABLE.contains(entity.getKind())) {
                decorators(entity, relationships);
                imports(entity, file.getImports(), relationships);
            }
        }
        calls(entities, lines, relationships);

        log.debug("🔗 Inferred {} relationships for {}", relationships.size(), file.getFilePath());
        return relationships;
    }

    private void inheritance(CodeEntity cls, List<CodeRelationship> out) {
        for (String base : cls.getBases()) {
            String target = baseName(base);
            if (target.isEmpty()) {
                continue;
            }
            out.add(byName(cls, target, EntityKind.CLASS, RelationshipKind.INHERITS_FROM));
        }
    }

    private void nestedClass(CodeEntity cls, List<CodeEntity> entities, List<CodeRelationship> out) {
        if (cls.getParentClass() == null) {
            return;
        }
        entities.stream()
                .filter(e -> e.getKind() == EntityKind.CLASS && e.getName().equals(cls.getParentClass()))
                .findFirst()
                .ifPresent(parent -> out.add(exact(parent, cls, RelationshipKind.CONTAINS)));
    }

    private void ownedBy(CodeEntity owned, List<CodeEntity> entities, RelationshipKind kind, List<CodeRelationship> out) {
        entities.stream()
                .filter(e -> e.getKind().isCallable() && ownerMatches(owned.getOwner(), e))
                .findFirst()
                .ifPresent(callable -> out.add(exact(callable, owned, kind)));
    }

    private void documentedBy(CodeEntity docstring, FileExtraction file, List<CodeEntity> entities, List<CodeRelationship> out) {
        if ("module".equals(docstring.getDocstringScope())) {
            out.add(CodeRelationship.builder()
                    .sourceName(file.getFilePath())
                    .sourceKind(EntityKind.FILE)
                    .sourceModule(file.getQualifiedModule())
                    .sourceKey(file.getFilePath())
                    .targetName(docstring.getName())
                    .targetKind(EntityKind.DOCSTRING)
                    .targetKey(docstring.graphKey())
                    .kind(RelationshipKind.DOCUMENTED_BY)
                    .build());
            return;
        }
        EntityKind ownerKind = "class".equals(docstring.getDocstringScope()) ? EntityKind.CLASS : null;
        entities.stream()
                .filter(e -> ownerKind == EntityKind.CLASS ? e.getKind() == EntityKind.CLASS : e.getKind().isCallable())
                .filter(e -> ownerMatches(docstring.getOwner(), e))
                .findFirst()
                .ifPresent(owner -> out.add(exact(owner, docstring, RelationshipKind.DOCUMENTED_BY)));
    }

    private void decorators(CodeEntity entity, List<CodeRelationship> out) {
        for (String decorator : entity.getDecorators()) {
            String target = decoratorName(decorator);
            if (!target.isEmpty()) {
                out.add(byName(entity, target, null, RelationshipKind.DECORATED_BY));
            }
        }
    }

    private void imports(CodeEntity entity, Set<String> imports, List<CodeRelationship> out) {
        String docstring = entity.getDocstring();
        if (docstring == null || docstring.isBlank()) {
            return;
        }
        for (String module : imports) {
            String lastSegment = module.substring(module.lastIndexOf('.') + 1);
            if (docstring.contains(module) || (!lastSegment.isEmpty() && docstring.contains(lastSegment))) {
                out.add(byName(entity, module, null, RelationshipKind.IMPORTS));
            }
        }
    }

    private void calls(List<CodeEntity> entities, String[] lines, List<CodeRelationship> out) {
        List<CodeEntity> callables = entities.stream().filter(e -> e.getKind().isCallable()).toList();

        for (CodeEntity callee : callables) {
            if (!calledOutsideDefinition(callee, lines)) {
                continue;
            }
            for (CodeEntity caller : callables) {
                if (caller.graphKey().equals(callee.graphKey())) {
                    continue;
                }
                if (caller.getCalls().contains(callee.getName())) {
                    out.add(exact(caller, callee, RelationshipKind.CALLS));
                }
            }
        }
    }

    private boolean calledOutsideDefinition(CodeEntity callee, String[] lines) {
        Pattern call = Pattern.compile("\\b" + Pattern.quote(callee.getName()) + "\\s*\\(");
        int definitionIndex = callee.getLineNumber() - 1;
        for (int i = 0; i < lines.length; i++) {
            if (i == definitionIndex) {
                continue;
            }
            if (call.matcher(lines[i]).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@code pkg.Base} gives Base, {@code Repository<User>} gives Repository, {@code Generic[T]} gives Generic.
     */
    static String baseName(String base) {
        String stripped = base.strip();
        int generic = indexOfAny(stripped, '<', '[', '(');
        if (generic >= 0) {
            stripped = stripped.substring(0, generic);
        }
        return stripped.substring(stripped.lastIndexOf('.') + 1).strip();
    }

    /**
     * {@code app.route("/x")} gives route, {@code Transactional(readOnly = true)} gives Transactional.
     */
    static String decoratorName(String decorator) {
        String stripped = decorator.strip();
        if (stripped.startsWith("@")) {
            stripped = stripped.substring(1);
        }
        int args = stripped.indexOf('(');
        if (args >= 0) {
            stripped = stripped.substring(0, args);
        }
        return stripped.substring(stripped.lastIndexOf('.') + 1).strip();
    }

    /**
     * Owner paths look like {@code func}, {@code Cls.method} or {@code Outer.Inner.method}.
     */
    private static boolean ownerMatches(String owner, CodeEntity candidate) {
        if (owner == null) {
            return false;
        }
        String suffix = candidate.getParentClass() == null
                ? candidate.getName()
                : candidate.getParentClass() + "." + candidate.getName();
        return owner.equals(suffix) || owner.endsWith("." + suffix);
    }

    private static int indexOfAny(String text, char... chars) {
        int best = -1;
        for (char c : chars) {
            int idx = text.indexOf(c);
            if (idx >= 0 && (best < 0 || idx < best)) {
                best = idx;
            }
        }
        return best;
    }

    private static CodeRelationship exact(CodeEntity source, CodeEntity target, RelationshipKind kind) {
        return CodeRelationship.builder()
                .sourceName(source.getName())
                .sourceKind(source.getKind())
                .sourceModule(source.getQualifiedModule())
                .sourceKey(source.graphKey())
                .targetName(target.getName())
                .targetKind(target.getKind())
                .targetKey(target.graphKey())
                .kind(kind)
                .lineNumber(source.getLineNumber())
                .build();
    }

    private static CodeRelationship byName(CodeEntity source, String targetName, EntityKind targetKind, RelationshipKind kind) {
        return CodeRelationship.builder()
                .sourceName(source.getName())
                .sourceKind(source.getKind())
                .sourceModule(source.getQualifiedModule())
                .sourceKey(source.graphKey())
                .targetName(targetName)
                .targetKind(targetKind)
                .kind(kind)
                .lineNumber(source.getLineNumber())
                .build();
    }
}
