package com.purchasingpower.codegraph.search;

import com.purchasingpower.codegraph.exception.EntityNotFoundException;

/**
 * Maps a natural-language query onto entities in the graph.
 *
 * <p>The two ranking lookups never throw for an unavailable or confused ranker;
 * they return a successful, empty {@link ResolutionResult} with a message instead.
 *
 * @since 1.0.0
 */
public interface EntityResolver {

    /**
     * The single entity that best matches the query.
     */
    ResolutionResult findBestEntity(String query);

    /**
     * Up to {@code limit} entities relevant to the query, best first.
     */
    ResolutionResult findTopEntities(String query, int limit);

    /**
     * Exact-name lookup with relationship expansion.
     *
     * @throws EntityNotFoundException when no node has that name; carries name suggestions
     */
    EntityRelationships findEntity(String name);
}
