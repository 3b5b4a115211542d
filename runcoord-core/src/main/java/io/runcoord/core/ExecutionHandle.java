package io.runcoord.core;

import java.util.Objects;

/**
 * Opaque reference to one run dispatched to the external execution API.
 */
public record ExecutionHandle(String id) {

    public ExecutionHandle {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
