package com.example.accessmanager.domain.bitwarden;

import com.example.accessmanager.domain.TomlText;

import java.util.Objects;

public record MemberCollectionAccess(String name) implements Comparable<MemberCollectionAccess> {
    public MemberCollectionAccess {
        Objects.requireNonNull(name, "name");
    }

    public String render() {
        return "{ " + TomlText.keyValue("member_name", name) + " }";
    }

    @Override
    public int compareTo(MemberCollectionAccess other) {
        return name.compareTo(other.name);
    }
}
