package com.example.accessmanager.domain.github;

import com.example.accessmanager.domain.Diffable;
import com.example.accessmanager.domain.TomlText;

import java.util.Comparator;
import java.util.Objects;

/**
 * A GitHub user and the role it holds in the organization. Users are
 * identified by id because user names can change.
 */
public record OrganizationMember(long userId, String userName, OrganizationRole role)
        implements Diffable<OrganizationMember, Long> {

    private static final Comparator<OrganizationMember> ORDER =
            Comparator.comparingLong(OrganizationMember::userId)
                    .thenComparing(OrganizationMember::userName)
                    .thenComparing(OrganizationMember::role);

    public OrganizationMember {
        Objects.requireNonNull(userName, "userName");
        Objects.requireNonNull(role, "role");
    }

    @Override
    public Long identity() {
        return userId;
    }

    @Override
    public String render() {
        return String.join(
                "\n",
                "[[member]]",
                TomlText.keyValue("github_user_id", userId),
                TomlText.keyValue("github_user_name", userName),
                TomlText.keyValue("organization_role", role.value()));
    }

    @Override
    public int compareTo(OrganizationMember other) {
        return ORDER.compare(this, other);
    }
}
