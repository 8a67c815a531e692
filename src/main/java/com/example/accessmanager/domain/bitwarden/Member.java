package com.example.accessmanager.domain.bitwarden;

import com.example.accessmanager.domain.Diffable;
import com.example.accessmanager.domain.TomlText;

import java.util.Comparator;
import java.util.Objects;

public record Member(String id, String name, String email, MemberType type, boolean accessAll)
        implements Diffable<Member, String> {

    private static final Comparator<Member> ORDER =
            Comparator.comparing(Member::id)
                    .thenComparing(Member::name)
                    .thenComparing(Member::email)
                    .thenComparing(Member::type)
                    .thenComparing(Member::accessAll);

    public Member {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(type, "type");
    }

    @Override
    public String identity() {
        return id;
    }

    @Override
    public String render() {
        return String.join(
                "\n",
                "[[member]]",
                TomlText.keyValue("member_id", id),
                TomlText.keyValue("member_name", name),
                TomlText.keyValue("email", email),
                TomlText.keyValue("type", type.value()),
                TomlText.keyValue("access_all", accessAll));
    }

    @Override
    public int compareTo(Member other) {
        return ORDER.compare(this, other);
    }
}
