package com.purchasingpower.codegraph.knowledge;

/**
 * Indexing states. A run moves PENDING, RUNNING, then COMPLETED or FAILED.
 *
 * @since 1.0.0
 */
public enum IndexingState {
    NOT_STARTED,
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
