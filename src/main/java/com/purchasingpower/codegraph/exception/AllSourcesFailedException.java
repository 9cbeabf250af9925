package com.purchasingpower.codegraph.exception;

/**
 * Every structural and semantic lookup for a query failed or came back empty.
 * Raised and handled inside the retrieval orchestrator.
 */
public class AllSourcesFailedException extends CodeGraphException {

    public AllSourcesFailedException(String query) {
        super("No retrieval source produced results for query: " + query);
    }
}
