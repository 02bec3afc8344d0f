package com.formwright.core.registry;

import com.formwright.surface.EntityKind;

/**
 * Thrown when an id is registered twice. The registry and the surface have drifted
 * apart; the caller must resolve it with an explicit rebuild, never by merging.
 */
public class DuplicateIdException extends RuntimeException {

    private final EntityKind kind;
    private final String id;

    public DuplicateIdException(EntityKind kind, String id) {
        super("Duplicate " + kind.name().toLowerCase() + " id: " + id);
        this.kind = kind;
        this.id = id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
