package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.knowledge.DependencyAnalyzer;
import com.purchasingpower.codegraph.knowledge.GraphStatistics;
import com.purchasingpower.codegraph.knowledge.IndexingService;
import com.purchasingpower.codegraph.knowledge.IndexingStatus;
import com.purchasingpower.codegraph.search.EntityRelationships;
import com.purchasingpower.codegraph.search.EntityResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for indexing and graph inspection.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/knowledge")
@RequiredArgsConstructor
public class KnowledgeController {

    private final IndexingService indexingService;
    private final DependencyAnalyzer dependencyAnalyzer;
    private final EntityResolver entityResolver;

    /**
     * Queue a repository for indexing and return immediately.
     *
     * POST /api/v1/knowledge/index
     */
    @PostMapping("/index")
    public ResponseEntity<IndexResponse> index(@RequestBody IndexRequest request) {
        if (request.getRepoUrl() == null || request.getRepoUrl().isBlank()) {
            return ResponseEntity.badRequest().body(IndexResponse.error("Repository URL is required"));
        }
        String repoId = request.getRepoId() != null && !request.getRepoId().isBlank()
                ? request.getRepoId()
                : repoIdOf(request.getRepoUrl());

        log.info("📥 Indexing requested for {} as {}", request.getRepoUrl(), repoId);
        IndexingStatus status = indexingService.accept(request.getRepoUrl(), repoId);
        indexingService.indexRepositoryAsync(request.getRepoUrl(), repoId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(IndexResponse.accepted(repoId, status.getState()));
    }

    /**
     * GET /api/v1/knowledge/index/{repoId}/status
     */
    @GetMapping("/index/{repoId}/status")
    public ResponseEntity<IndexingStatus> getIndexingStatus(@PathVariable String repoId) {
        return ResponseEntity.ok(indexingService.getStatus(repoId));
    }

    /**
     * Wipe the graph and the repository's vector namespace.
     *
     * DELETE /api/v1/knowledge/index?repoId=...
     */
    @DeleteMapping("/index")
    public ResponseEntity<Map<String, Object>> clearIndex(@RequestParam String repoId) {
        indexingService.clearIndex(repoId);
        return ResponseEntity.ok(Map.of("success", true, "repoId", repoId));
    }

    @GetMapping("/stats")
    public ResponseEntity<GraphStatistics> getStatistics() {
        return ResponseEntity.ok(indexingService.getStatistics());
    }

    @GetMapping("/entities/{name}")
    public ResponseEntity<EntityRelationships> getEntity(@PathVariable String name) {
        return ResponseEntity.ok(entityResolver.findEntity(name));
    }

    /**
     * Dependency cycles over CALLS, IMPORTS and INHERITS_FROM.
     */
    @GetMapping("/cycles")
    public ResponseEntity<List<List<String>>> getCycles() {
        return ResponseEntity.ok(dependencyAnalyzer.findCycles());
    }

    @GetMapping("/entities/{name}/depth")
    public ResponseEntity<Map<String, Object>> getDependencyDepth(@PathVariable String name) {
        return ResponseEntity.ok(Map.of("entity", name, "depth", dependencyAnalyzer.dependencyDepth(name)));
    }

    static String repoIdOf(String repoUrl) {
        String trimmed = repoUrl.trim().replaceAll("[/\\\\]+$", "");
        String last = trimmed.substring(Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\')) + 1);
        if (last.endsWith(".git")) {
            last = last.substring(0, last.length() - 4);
        }
        return last.isEmpty() ? "default" : last;
    }
}
