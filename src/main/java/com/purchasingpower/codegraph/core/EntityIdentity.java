package com.purchasingpower.codegraph.core;

/**
 * Identity of an extracted entity: name, qualified module and kind.
 *
 * <p>Two extractions of an unchanged file yield equal identities.
 */
public record EntityIdentity(String name, String qualifiedModule, EntityKind kind) {
}
