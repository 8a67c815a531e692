package com.example.accessmanager.domain.bitwarden;

import com.example.accessmanager.domain.TomlText;

import java.util.Comparator;
import java.util.Objects;

public record GroupCollectionAccess(String name, GroupAccess access)
        implements Comparable<GroupCollectionAccess> {

    private static final Comparator<GroupCollectionAccess> ORDER =
            Comparator.comparing(GroupCollectionAccess::name)
                    .thenComparing(GroupCollectionAccess::access);

    public GroupCollectionAccess {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(access, "access");
    }

    public String render() {
        return "{ " + TomlText.keyValue("group_name", name) + ", "
                + TomlText.keyValue("access", access.value()) + " }";
    }

    @Override
    public int compareTo(GroupCollectionAccess other) {
        return ORDER.compare(this, other);
    }
}
