package com.example.accessmanager.domain;

import java.util.Objects;

/** A pair of entries that share an identity but differ in value. */
public record DiffEntry<T>(T actual, T target) {
    public DiffEntry {
        Objects.requireNonNull(actual, "actual");
        Objects.requireNonNull(target, "target");
    }
}
