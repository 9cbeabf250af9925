package com.purchasingpower.codegraph.api;

/**
 * Body of every error response.
 */
public record ErrorResponse(String error, String message) {
}
