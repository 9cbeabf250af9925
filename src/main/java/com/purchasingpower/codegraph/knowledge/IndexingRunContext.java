package com.purchasingpower.codegraph.knowledge;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.purchasingpower.codegraph.core.CodeEntity;
import com.purchasingpower.codegraph.core.EntityKind;
import com.purchasingpower.codegraph.core.FileExtraction;
import com.purchasingpower.codegraph.parser.ModulePaths;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of one repository-indexing run: the name index used to resolve edge
 * targets across files, and the write counters.
 *
 * <p>Created per run and discarded afterwards. Not thread-safe; a run writes single-flow.
 */
public class IndexingRunContext {

    private static final int MAX_RECORDED_ERRORS = 100;

    @Getter
    private final String repoId;
    @Getter
    private final List<FileExtraction> extractions;
    private final Set<String> packages = new LinkedHashSet<>();
    private final Set<String> functionNames = new HashSet<>();
    private final Map<String, String> moduleToFilePath = new HashMap<>();
    private final ListMultimap<String, CodeEntity> entitiesByName = ArrayListMultimap.create();

    @Getter
    private int packagesCreated;
    @Getter
    private int filesCreated;
    @Getter
    private int entitiesCreated;
    @Getter
    private int relationshipsCreated;
    @Getter
    private int entityErrors;
    @Getter
    private int relationshipErrors;
    private final List<String> errors = new ArrayList<>();

    public IndexingRunContext(String repoId, List<FileExtraction> extractions) {
        this.repoId = repoId;
        this.extractions = List.copyOf(extractions);
        for (FileExtraction file : this.extractions) {
            register(file);
        }
    }

    private void register(FileExtraction file) {
        packages.addAll(ModulePaths.packagePrefixes(file.getPackageName()));
        moduleToFilePath.put(file.getQualifiedModule(), file.getFilePath());
        for (CodeEntity entity : file.getEntities()) {
            entitiesByName.put(entity.getName(), entity);
            if (entity.getKind() == EntityKind.FUNCTION) {
                functionNames.add(entity.getName());
            }
        }
    }

    /**
     * Every package derived from the module paths of this run, outermost first.
     */
    public Set<String> getPackages() {
        return Collections.unmodifiableSet(packages);
    }

    public boolean isPackage(String name) {
        return packages.contains(name);
    }

    public Optional<String> filePathOfModule(String module) {
        return Optional.ofNullable(moduleToFilePath.get(module));
    }

    /**
     * Label for a callable known only by name: Function if the name was seen as a
     * top-level function anywhere in this run, Method otherwise.
     */
    public EntityKind callableKindFor(String name) {
        return functionNames.contains(name) ? EntityKind.FUNCTION : EntityKind.METHOD;
    }

    /**
     * Finds an entity by name and kind, preferring the given module.
     */
    public Optional<CodeEntity> resolve(String name, EntityKind kind, String preferredModule) {
        List<CodeEntity> candidates = entitiesByName.get(name).stream()
                .filter(e -> e.getKind() == kind)
                .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return candidates.stream()
                .filter(e -> e.getQualifiedModule().equals(preferredModule))
                .findFirst()
                .or(() -> Optional.of(candidates.get(0)));
    }

    void packageCreated() {
        packagesCreated++;
    }

    void fileCreated() {
        filesCreated++;
    }

    void entityCreated() {
        entitiesCreated++;
    }

    void relationshipCreated() {
        relationshipsCreated++;
    }

    void entityFailed(String message) {
        entityErrors++;
        recordError(message);
    }

    void relationshipFailed(String message) {
        relationshipErrors++;
        recordError(message);
    }

    private void recordError(String message) {
        if (errors.size() < MAX_RECORDED_ERRORS) {
            errors.add(message);
        }
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }
}
