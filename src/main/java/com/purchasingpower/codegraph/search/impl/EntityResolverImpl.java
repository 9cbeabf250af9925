package com.purchasingpower.codegraph.search.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.client.ReasoningService;
import com.purchasingpower.codegraph.config.GeminiConfig;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.exception.EntityNotFoundException;
import com.purchasingpower.codegraph.exception.RankingUnavailableException;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.knowledge.RelationshipMappings;
import com.purchasingpower.codegraph.search.EntityRelationships;
import com.purchasingpower.codegraph.search.EntityResolver;
import com.purchasingpower.codegraph.search.RankedEntity;
import com.purchasingpower.codegraph.search.ResolutionResult;
import com.purchasingpower.codegraph.service.PromptLibraryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entity resolution in three steps: load a bounded inventory of entity names, let the
 * reasoning service pick from it, then verify and expand each pick against the graph.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class EntityResolverImpl implements EntityResolver {

    static final String UNAVAILABLE_MESSAGE = "LLM could not identify relevant entities";
    static final String UNPARSEABLE_MESSAGE = "Could not parse LLM response";
    static final String NOT_FOUND_MESSAGE = "Entity not found";

    static final String INVENTORY_QUERY = """
            MATCH (n) WHERE n.name IS NOT NULL
            RETURN DISTINCT n.name AS name, labels(n)[0] AS type
            ORDER BY name
            LIMIT $limit
            """;

    static final String VERIFY_QUERY = "MATCH (n {name: $name}) RETURN labels(n)[0] AS type LIMIT 1";

    static final String SUGGESTION_QUERY = """
            MATCH (n) WHERE n.name IS NOT NULL AND toLower(n.name) CONTAINS toLower($name)
            RETURN DISTINCT n.name AS name
            ORDER BY name
            LIMIT 5
            """;

    private static final String SINGLE_PROMPT = "entity-ranking";
    private static final String TOP_K_PROMPT = "entity-ranking-top-k";

    private final GraphStore graphStore;
    private final ReasoningService reasoningService;
    private final PromptLibraryService promptLibrary;
    private final GeminiConfig geminiConfig;
    private final ObjectMapper objectMapper;
    private final int inventoryLimit;

    public EntityResolverImpl(GraphStore graphStore,
                              ReasoningService reasoningService,
                              PromptLibraryService promptLibrary,
                              GeminiConfig geminiConfig,
                              ObjectMapper objectMapper,
                              AppProperties props) {
        this.graphStore = graphStore;
        this.reasoningService = reasoningService;
        this.promptLibrary = promptLibrary;
        this.geminiConfig = geminiConfig;
        this.objectMapper = objectMapper;
        this.inventoryLimit = props.getRetrieval().getInventoryLimit();
    }

    @Override
    public ResolutionResult findBestEntity(String query) {
        log.info("🔍 Finding best entity for: {}", query);
        return resolve(query, SINGLE_PROMPT, 1);
    }

    @Override
    public ResolutionResult findTopEntities(String query, int limit) {
        log.info("🔍 Finding top {} entities for: {}", limit, query);
        return resolve(query, TOP_K_PROMPT, Math.max(1, limit));
    }

    @Override
    public EntityRelationships findEntity(String name) {
        List<Map<String, Object>> rows = graphStore.execute(RelationshipMappings.EXPANSION_QUERY, Map.of("name", name));
        if (rows.isEmpty()) {
            List<String> suggestions = new ArrayList<>();
            for (Map<String, Object> row : graphStore.execute(SUGGESTION_QUERY, Map.of("name", name))) {
                suggestions.add(String.valueOf(row.get("name")));
            }
            log.info("❓ Entity '{}' not found ({} suggestions)", name, suggestions.size());
            throw new EntityNotFoundException(name, suggestions);
        }
        return EntityRelationships.fromRow(rows.get(0));
    }

    private ResolutionResult resolve(String query, String promptName, int limit) {
        List<Map<String, Object>> inventory;
        try {
            inventory = loadInventory();
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not load entity inventory: {}", e.getMessage());
            return ResolutionResult.degraded("Could not load entity inventory: " + e.getMessage());
        }
        if (inventory.isEmpty()) {
            return ResolutionResult.degraded("No entities indexed");
        }

        List<RankedEntity> picks;
        try {
            picks = rank(query, promptName, inventory, limit);
        } catch (RankingUnavailableException e) {
            log.warn("⚠️ Ranking degraded: {}", e.getMessage());
            return ResolutionResult.degraded(e.getMessage());
        }

        ResolutionResult.ResolutionResultBuilder result = ResolutionResult.builder().success(true);
        for (RankedEntity pick : picks) {
            result.entity(verifyAndExpand(pick));
        }
        ResolutionResult resolved = result.build();
        log.info("✅ Ranked {} entities, {} found in graph", resolved.getEntities().size(), resolved.getFoundEntities().size());
        if (resolved.getEntities().isEmpty()) {
            return resolved.toBuilder().message(UNAVAILABLE_MESSAGE).build();
        }
        if (!resolved.hasFoundEntities()) {
            return resolved.toBuilder().message("None of the ranked entities exist in the graph").build();
        }
        return resolved;
    }

    private List<Map<String, Object>> loadInventory() {
        return graphStore.execute(INVENTORY_QUERY, Map.of("limit", inventoryLimit));
    }

    List<RankedEntity> rank(String query, String promptName, List<Map<String, Object>> inventory, int limit) {
        Map<String, Object> variables = Map.of("query", query, "entities", inventory, "limit", limit);
        String response;
        try {
            response = reasoningService.complete(
                    promptLibrary.renderSystem(promptName, variables),
                    promptLibrary.renderUser(promptName, variables),
                    geminiConfig.getJsonTemperature());
        } catch (RuntimeException e) {
            throw new RankingUnavailableException(UNAVAILABLE_MESSAGE, e);
        }
        if (response == null || response.isBlank()) {
            throw new RankingUnavailableException(UNAVAILABLE_MESSAGE);
        }

        boolean multiple = TOP_K_PROMPT.equals(promptName);
        JsonNode root = parseJson(response, multiple ? '[' : '{', multiple ? ']' : '}');

        List<RankedEntity> picks = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Iterable<JsonNode> nodes = root.isArray() ? root : List.of(root);
        for (JsonNode node : nodes) {
            String name = node.path("entity_name").asText("").trim();
            if (name.isEmpty() || !seen.add(name)) {
                continue;
            }
            picks.add(RankedEntity.builder()
                    .name(name)
                    .type(node.path("entity_type").asText(null))
                    .confidence(node.hasNonNull("confidence") ? node.get("confidence").asDouble() : null)
                    .reason(node.path("reason").asText(null))
                    .build());
            if (picks.size() >= limit) {
                break;
            }
        }
        return picks;
    }

    /**
     * Parses the text between the first {@code open} and the last {@code close}.
     */
    JsonNode parseJson(String response, char open, char close) {
        int start = response.indexOf(open);
        int end = response.lastIndexOf(close);
        if (start < 0 || end <= start) {
            throw new RankingUnavailableException(UNPARSEABLE_MESSAGE);
        }
        try {
            return objectMapper.readTree(response.substring(start, end + 1));
        } catch (Exception e) {
            throw new RankingUnavailableException(UNPARSEABLE_MESSAGE, e);
        }
    }

    private RankedEntity verifyAndExpand(RankedEntity pick) {
        try {
            List<Map<String, Object>> rows = graphStore.execute(VERIFY_QUERY, Map.of("name", pick.getName()));
            if (rows.isEmpty()) {
                log.debug("Ranked entity '{}' is not in the graph", pick.getName());
                return pick.toBuilder().found(false).message(NOT_FOUND_MESSAGE).build();
            }
            String type = String.valueOf(rows.get(0).get("type"));
            return pick.toBuilder()
                    .found(true)
                    .type(type)
                    .relationships(expand(pick.getName(), type))
                    .build();
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not verify '{}': {}", pick.getName(), e.getMessage());
            return pick.toBuilder().found(false).message("Entity lookup failed: " + e.getMessage()).build();
        }
    }

    private EntityRelationships expand(String name, String type) {
        try {
            List<Map<String, Object>> rows = graphStore.execute(RelationshipMappings.EXPANSION_QUERY, Map.of("name", name));
            return rows.isEmpty() ? EntityRelationships.isolated(name, type) : EntityRelationships.fromRow(rows.get(0));
        } catch (RuntimeException e) {
            log.warn("⚠️ Relationship expansion failed for '{}': {}", name, e.getMessage());
            return EntityRelationships.isolated(name, type);
        }
    }
}
