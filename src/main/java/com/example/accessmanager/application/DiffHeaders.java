package com.example.accessmanager.application;

import java.util.Objects;

/** Section headers printed above the additions, removals and changes of a diff. */
public record DiffHeaders(String toAdd, String toRemove, String toChange) {
    public DiffHeaders {
        Objects.requireNonNull(toAdd, "toAdd");
        Objects.requireNonNull(toRemove, "toRemove");
        Objects.requireNonNull(toChange, "toChange");
    }
}
