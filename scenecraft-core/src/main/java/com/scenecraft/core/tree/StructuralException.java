package com.scenecraft.core.tree;

/**
 * Thrown when a tree operation would violate a structural invariant, such as
 * inserting under a container that is not part of the scene.
 *
 * <p>This signals an engine bug rather than bad service data. Callers driving a
 * multi-round run catch it per operation, log it, and continue.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }
}
