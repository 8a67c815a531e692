package com.example.accessmanager.domain;

import java.util.List;

/**
 * Holds the classified differences for one entity kind.
 */
public record DiffResult<T>(List<T> toAdd, List<T> toRemove, List<DiffEntry<T>> toChange) {
    public DiffResult {
        toAdd = List.copyOf(toAdd);
        toRemove = List.copyOf(toRemove);
        toChange = List.copyOf(toChange);
    }

    public boolean isEmpty() {
        return toAdd.isEmpty() && toRemove.isEmpty() && toChange.isEmpty();
    }
}
