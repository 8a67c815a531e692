package com.example.accessmanager.domain;

/**
 * An entity that can be compared between the declared target state and the
 * state observed on a remote service.
 *
 * <p>Equality and ordering come from the implementing type. The identity is
 * used to correlate entries of the two sides: an entry that must be both
 * added and removed under the same identity is reported as a change instead.
 * Pure relationship records derive their identity from their full value, so
 * they are only ever added or removed.
 *
 * @param <T> the implementing entity kind
 * @param <K> the identity key type
 */
public interface Diffable<T, K extends Comparable<K>> extends Comparable<T> {

    K identity();

    /**
     * Canonical textual form, in the layout of the configuration file where
     * the kind has one.
     */
    String render();
}
