package com.example.accessmanager.application;

import com.example.accessmanager.domain.DiffEntry;
import com.example.accessmanager.domain.DiffResult;
import com.example.accessmanager.domain.Diffable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifies the differences between a target and an actual set of entities
 * into additions, removals and in-place changes.
 */
@Service
public class StateDiffer {
    private static final Logger log = LogManager.getLogger(StateDiffer.class);

    /**
     * Computes the diff of one entity kind.
     *
     * <p>An entry that would be both added and removed under the same identity
     * is reported as a single change. When several entries of one side share an
     * identity, the one that sorts last is paired; the others remain plain
     * additions or removals.
     */
    public <T extends Diffable<T, K>, K extends Comparable<K>> DiffResult<T> diff(
            Set<T> target, Set<T> actual) {
        List<T> toAdd = new ArrayList<>();
        for (T entry : target) {
            if (!actual.contains(entry)) {
                toAdd.add(entry);
            }
        }
        List<T> toRemove = new ArrayList<>();
        for (T entry : actual) {
            if (!target.contains(entry)) {
                toRemove.add(entry);
            }
        }
        toAdd.sort(Comparator.naturalOrder());
        toRemove.sort(Comparator.naturalOrder());

        Map<K, T> toAddById = indexByIdentity(toAdd, "target");
        Map<K, T> toRemoveById = indexByIdentity(toRemove, "actual");

        Set<K> sharedIds = new TreeSet<>(toAddById.keySet());
        sharedIds.retainAll(toRemoveById.keySet());

        List<DiffEntry<T>> toChange = new ArrayList<>(sharedIds.size());
        for (K id : sharedIds) {
            DiffEntry<T> change = new DiffEntry<>(toRemoveById.get(id), toAddById.get(id));
            toChange.add(change);
            toAdd.remove(change.target());
            toRemove.remove(change.actual());
        }

        if (!toChange.isEmpty() || !toAdd.isEmpty() || !toRemove.isEmpty()) {
            log.debug(
                    "Diff classified {} additions, {} removals, {} changes",
                    toAdd.size(),
                    toRemove.size(),
                    toChange.size());
        }
        return new DiffResult<>(toAdd, toRemove, toChange);
    }

    private static <T extends Diffable<T, K>, K extends Comparable<K>> Map<K, T> indexByIdentity(
            List<T> sortedEntries, String side) {
        Map<K, T> byId = new HashMap<>();
        for (T entry : sortedEntries) {
            T previous = byId.put(entry.identity(), entry);
            if (previous != null) {
                log.warn(
                        "Identity {} is shared by several {} entries; pairing the last in sort order",
                        entry.identity(),
                        side);
            }
        }
        return byId;
    }
}
