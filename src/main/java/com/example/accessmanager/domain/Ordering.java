package com.example.accessmanager.domain;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Comparators used to give entity kinds a field-lexicographic order.
 */
public final class Ordering {
    private Ordering() {}

    public static <E> Comparator<List<E>> lexicographic(Comparator<? super E> elementOrder) {
        return (left, right) -> {
            Iterator<E> l = left.iterator();
            Iterator<E> r = right.iterator();
            while (l.hasNext() && r.hasNext()) {
                int cmp = elementOrder.compare(l.next(), r.next());
                if (cmp != 0) {
                    return cmp;
                }
            }
            return Boolean.compare(l.hasNext(), r.hasNext());
        };
    }

    public static <E extends Comparable<? super E>> Comparator<List<E>> lexicographic() {
        return lexicographic(Comparator.<E>naturalOrder());
    }
}
