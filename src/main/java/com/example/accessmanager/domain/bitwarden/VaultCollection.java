package com.example.accessmanager.domain.bitwarden;

import com.example.accessmanager.domain.Diffable;
import com.example.accessmanager.domain.Ordering;
import com.example.accessmanager.domain.TomlText;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A collection and the groups and members that can access it. Access lists
 * are kept sorted; {@code null} means the list is not declared, which is
 * not the same as an empty list.
 */
public record VaultCollection(
        String id,
        String externalId,
        List<GroupCollectionAccess> groupAccess,
        List<MemberCollectionAccess> memberAccess)
        implements Diffable<VaultCollection, String> {

    private static final Comparator<VaultCollection> ORDER =
            Comparator.comparing(VaultCollection::id)
                    .thenComparing(VaultCollection::externalId)
                    .thenComparing(
                            VaultCollection::groupAccess,
                            Comparator.nullsFirst(Ordering.<GroupCollectionAccess>lexicographic()))
                    .thenComparing(
                            VaultCollection::memberAccess,
                            Comparator.nullsFirst(Ordering.<MemberCollectionAccess>lexicographic()));

    public VaultCollection {
        Objects.requireNonNull(id, "id");
        externalId = externalId != null ? externalId : "";
        groupAccess = groupAccess != null ? groupAccess.stream().sorted().toList() : null;
        memberAccess = memberAccess != null ? memberAccess.stream().sorted().toList() : null;
    }

    @Override
    public String identity() {
        return id;
    }

    @Override
    public String render() {
        List<String> lines = new ArrayList<>();
        lines.add("[[collection]]");
        lines.add(TomlText.keyValue("collection_id", id));
        lines.add(TomlText.keyValue("external_id", externalId));
        if (memberAccess != null) {
            appendArray(lines, "member_access", memberAccess, MemberCollectionAccess::render);
        }
        if (groupAccess != null) {
            appendArray(lines, "group_access", groupAccess, GroupCollectionAccess::render);
        }
        return String.join("\n", lines);
    }

    private static <E> void appendArray(
            List<String> lines, String key, List<E> entries, Function<E, String> renderer) {
        if (entries.isEmpty()) {
            lines.add(key + " = []");
            return;
        }
        lines.add(key + " = [");
        for (E entry : entries) {
            lines.add("  " + renderer.apply(entry) + ",");
        }
        lines.add("]");
    }

    @Override
    public int compareTo(VaultCollection other) {
        return ORDER.compare(this, other);
    }
}
