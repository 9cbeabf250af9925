package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.core.CodeEntity;
import com.purchasingpower.codegraph.core.CodeRelationship;
import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.core.FileExtraction;
import com.purchasingpower.codegraph.core.RelationshipKind;
import com.purchasingpower.codegraph.exception.RelationshipWriteException;
import com.purchasingpower.codegraph.parser.ModulePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes one indexing run into the graph in four phases: packages, files,
 * entities, relationships.
 *
 * <p>Every node and edge write is isolated. A failure is logged, counted on the
 * {@link IndexingRunContext} and skipped; nothing is rolled back.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphUpsertEngine {

    static final String EXTERNAL_MODULE = "builtins";
    static final String DECORATOR_LABEL = "Decorator";

    private final GraphStore graphStore;
    private final RelationshipInferencer relationshipInferencer;

    public void upsert(IndexingRunContext context) {
        log.info("🧱 Upserting {} files into graph for {}", context.getExtractions().size(), context.getRepoId());

        upsertPackages(context);
        for (FileExtraction file : context.getExtractions()) {
            upsertFile(file, context);
        }
        for (FileExtraction file : context.getExtractions()) {
            upsertEntities(file, context);
        }
        for (FileExtraction file : context.getExtractions()) {
            upsertRelationships(file, context);
        }

        log.info("✅ Graph upsert done: {} packages, {} files, {} entities, {} relationships ({} entity errors, {} relationship errors)",
                context.getPackagesCreated(), context.getFilesCreated(), context.getEntitiesCreated(),
                context.getRelationshipsCreated(), context.getEntityErrors(), context.getRelationshipErrors());
    }

    // =========================================================================
    // Phase 1: packages
    // =========================================================================

    private void upsertPackages(IndexingRunContext context) {
        for (String pkg : context.getPackages()) {
            if (writeNode(context, EntityKind.PACKAGE.getLabel(), pkg, Map.of("name", pkg))) {
                context.packageCreated();
            }
        }
        for (String pkg : context.getPackages()) {
            String parent = ModulePaths.parentPackage(pkg);
            if (parent != null && context.isPackage(parent)) {
                writeEdge(context, parent, EntityKind.PACKAGE.getLabel(), pkg, EntityKind.PACKAGE.getLabel(), RelationshipKind.CONTAINS);
            }
        }
    }

    // =========================================================================
    // Phase 2: files
    // =========================================================================

    private void upsertFile(FileExtraction file, IndexingRunContext context) {
        Map<String, Object> props = new HashMap<>();
        props.put("name", fileName(file.getFilePath()));
        props.put("path", file.getFilePath());
        props.put("module", file.getQualifiedModule());
        props.put("language", file.getLanguage());
        props.put("repo_id", context.getRepoId());

        if (!writeNode(context, EntityKind.FILE.getLabel(), file.getFilePath(), props)) {
            return;
        }
        context.fileCreated();

        String pkg = file.getPackageName();
        if (pkg != null && !pkg.isEmpty() && context.isPackage(pkg)) {
            writeEdge(context, pkg, EntityKind.PACKAGE.getLabel(), file.getFilePath(), EntityKind.FILE.getLabel(), RelationshipKind.CONTAINS);
        }
    }

    // =========================================================================
    // Phase 3: entities
    // =========================================================================

    private void upsertEntities(FileExtraction file, IndexingRunContext context) {
        for (CodeEntity entity : file.getEntities()) {
            if (!writeNode(context, entity.getKind().getLabel(), entity.graphKey(), propertiesOf(entity))) {
                continue;
            }
            context.entityCreated();

            EntityKind kind = entity.getKind();
            if (kind == EntityKind.CLASS || kind.isCallable()) {
                writeEdge(context, file.getFilePath(), EntityKind.FILE.getLabel(),
                        entity.graphKey(), kind.getLabel(), RelationshipKind.DEFINES);
            }
            if (kind == EntityKind.METHOD && entity.getParentClass() != null) {
                String classKey = entity.getQualifiedModule() + "." + entity.getParentClass();
                writeEdge(context, classKey, EntityKind.CLASS.getLabel(),
                        entity.graphKey(), EntityKind.METHOD.getLabel(), RelationshipKind.HAS_METHOD);
            }
        }
    }

    private Map<String, Object> propertiesOf(CodeEntity entity) {
        Map<String, Object> props = new HashMap<>();
        props.put("name", entity.getName());
        props.put("module", entity.getQualifiedModule());
        props.put("file_path", entity.getFilePath());
        props.put("line_number", entity.getLineNumber());

        switch (entity.getKind()) {
            case CLASS -> {
                putIfPresent(props, "docstring", entity.getDocstring());
                props.put("decorators", entity.getDecorators());
                props.put("bases", entity.getBases());
                putIfPresent(props, "parent_class", entity.getParentClass());
            }
            case FUNCTION, METHOD -> {
                putIfPresent(props, "docstring", entity.getDocstring());
                props.put("decorators", entity.getDecorators());
                props.put("parameters", entity.getParameters());
                putIfPresent(props, "return_type", entity.getReturnType());
                props.put("is_async", entity.isAsync());
                putIfPresent(props, "parent_class", entity.getParentClass());
            }
            case PARAMETER, RETURN_TYPE -> putIfPresent(props, "owner", entity.getOwner());
            case DOCSTRING -> {
                putIfPresent(props, "content", entity.getDocstring());
                putIfPresent(props, "scope", entity.getDocstringScope());
                putIfPresent(props, "owner", entity.getOwner());
            }
            default -> {
                // packages and files are written in their own phases
            }
        }
        return props;
    }

    // =========================================================================
    // Phase 4: relationships
    // =========================================================================

    private void upsertRelationships(FileExtraction file, IndexingRunContext context) {
        List<CodeRelationship> relationships;
        try {
            relationships = relationshipInferencer.infer(file);
        } catch (RuntimeException e) {
            log.error("❌ Relationship inference failed for {}: {}", file.getFilePath(), e.getMessage(), e);
            context.relationshipFailed("Inference failed for " + file.getFilePath() + ": " + e.getMessage());
            return;
        }

        for (CodeRelationship rel : relationships) {
            try {
                writeRelationship(rel, context);
                context.relationshipCreated();
            } catch (RelationshipWriteException e) {
                log.debug("⚠️ Skipping relationship: {}", e.getMessage());
                context.relationshipFailed(e.getMessage());
            } catch (RuntimeException e) {
                log.warn("⚠️ Failed to write relationship {} {} -> {}: {}",
                        rel.getKind(), rel.getSourceName(), rel.getTargetName(), e.getMessage());
                context.relationshipFailed(new RelationshipWriteException(rel, e).getMessage());
            }
        }
    }

    private void writeRelationship(CodeRelationship rel, IndexingRunContext context) {
        String sourceLabel = rel.getSourceKind().getLabel();
        if (rel.hasExactKeys()) {
            upsertEdgeOrThrow(rel, rel.getSourceKey(), sourceLabel, rel.getTargetKey(), rel.getTargetKind().getLabel());
            return;
        }

        ResolvedTarget target = resolveTarget(rel, context)
                .orElseThrow(() -> new RelationshipWriteException(rel, "target not found in this run"));
        upsertEdgeOrThrow(rel, rel.getSourceKey(), sourceLabel, target.key(), target.label());
    }

    private void upsertEdgeOrThrow(CodeRelationship rel, String sourceKey, String sourceLabel, String targetKey, String targetLabel) {
        if (!RelationshipMappings.validate(sourceLabel, rel.getKind(), targetLabel)) {
            throw new RelationshipWriteException(rel, sourceLabel + " -> " + targetLabel + " is not a valid " + rel.getKind() + " edge");
        }
        try {
            graphStore.upsertEdge(sourceKey, sourceLabel, targetKey, targetLabel, rel.getKind());
        } catch (RelationshipWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RelationshipWriteException(rel, e);
        }
    }

    private Optional<ResolvedTarget> resolveTarget(CodeRelationship rel, IndexingRunContext context) {
        String name = rel.getTargetName();
        String module = rel.getSourceModule();

        return switch (rel.getKind()) {
            case INHERITS_FROM -> Optional.of(context.resolve(name, EntityKind.CLASS, module)
                    .map(ResolvedTarget::of)
                    .orElseGet(() -> externalClass(name)));
            case DECORATED_BY -> Optional.of(resolveCallable(name, module, context)
                    .or(() -> context.resolve(name, EntityKind.CLASS, module).map(ResolvedTarget::of))
                    .orElseGet(() -> decoratorPlaceholder(name)));
            case IMPORTS -> resolveModule(name, context);
            case CALLS -> resolveCallable(name, module, context);
            default -> {
                EntityKind hint = rel.getTargetKind();
                yield hint == null ? Optional.empty() : context.resolve(name, hint, module).map(ResolvedTarget::of);
            }
        };
    }

    private Optional<ResolvedTarget> resolveCallable(String name, String module, IndexingRunContext context) {
        return context.resolve(name, context.callableKindFor(name), module).map(ResolvedTarget::of);
    }

    private Optional<ResolvedTarget> resolveModule(String module, IndexingRunContext context) {
        if (context.isPackage(module)) {
            return Optional.of(new ResolvedTarget(module, EntityKind.PACKAGE.getLabel()));
        }
        return context.filePathOfModule(module)
                .map(path -> new ResolvedTarget(path, EntityKind.FILE.getLabel()));
    }

    private ResolvedTarget externalClass(String name) {
        String key = EXTERNAL_MODULE + "." + name;
        graphStore.upsertNode(EntityKind.CLASS.getLabel(), key, Map.of(
                "name", name,
                "module", EXTERNAL_MODULE,
                "external", true));
        return new ResolvedTarget(key, EntityKind.CLASS.getLabel());
    }

    private ResolvedTarget decoratorPlaceholder(String name) {
        String key = "decorator:" + name;
        graphStore.upsertNode(DECORATOR_LABEL, key, Map.of("name", name));
        return new ResolvedTarget(key, DECORATOR_LABEL);
    }

    // =========================================================================
    // Isolated writes
    // =========================================================================

    private boolean writeNode(IndexingRunContext context, String label, String key, Map<String, Object> props) {
        try {
            graphStore.upsertNode(label, key, props);
            return true;
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to write {} node {}: {}", label, key, e.getMessage());
            context.entityFailed("Failed to write " + label + " " + key + ": " + e.getMessage());
            return false;
        }
    }

    private void writeEdge(IndexingRunContext context, String sourceKey, String sourceLabel,
                           String targetKey, String targetLabel, RelationshipKind kind) {
        try {
            graphStore.upsertEdge(sourceKey, sourceLabel, targetKey, targetLabel, kind);
            context.relationshipCreated();
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to write {} edge {} -> {}: {}", kind, sourceKey, targetKey, e.getMessage());
            context.relationshipFailed("Failed to write " + kind + " " + sourceKey + " -> " + targetKey + ": " + e.getMessage());
        }
    }

    private static void putIfPresent(Map<String, Object> props, String key, Object value) {
        if (value != null) {
            props.put(key, value);
        }
    }

    private static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private record ResolvedTarget(String key, String label) {
        static ResolvedTarget of(CodeEntity entity) {
            return new ResolvedTarget(entity.graphKey(), entity.getKind().getLabel());
        }
    }
}
