package com.example.accessmanager.domain.bitwarden;

import com.example.accessmanager.domain.Diffable;
import com.example.accessmanager.domain.TomlText;

import java.util.Comparator;
import java.util.Objects;

public record Group(String id, String name, boolean accessAll) implements Diffable<Group, String> {

    private static final Comparator<Group> ORDER =
            Comparator.comparing(Group::id)
                    .thenComparing(Group::name)
                    .thenComparing(Group::accessAll);

    public Group {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String identity() {
        return id;
    }

    @Override
    public String render() {
        return String.join(
                "\n",
                "[[group]]",
                TomlText.keyValue("group_id", id),
                TomlText.keyValue("group_name", name),
                TomlText.keyValue("access_all", accessAll));
    }

    @Override
    public int compareTo(Group other) {
        return ORDER.compare(this, other);
    }
}
