/**
 * Core domain model for the code graph.
 *
 * <p>Contains the fundamental types shared by indexing and retrieval:
 * <ul>
 *   <li>CodeEntity - an extracted class, function, method, parameter, return type or docstring</li>
 *   <li>CodeRelationship - a typed directed edge between two entities</li>
 *   <li>CodeChunk - a fixed-size line range of a source file used for semantic search</li>
 *   <li>FileExtraction - everything extracted from one source file</li>
 * </ul>
 *
 * <p>This package has no Spring or driver dependencies.
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.core;
