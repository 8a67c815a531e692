package com.example.accessmanager.domain.github;

import com.example.accessmanager.domain.Diffable;

import java.util.Comparator;
import java.util.Objects;

/**
 * Membership of a user in a team. A membership has no id of its own, so its
 * identity is the full value.
 */
public record TeamMember(long userId, String userName, String teamName)
        implements Diffable<TeamMember, TeamMember> {

    private static final Comparator<TeamMember> ORDER =
            Comparator.comparingLong(TeamMember::userId)
                    .thenComparing(TeamMember::userName)
                    .thenComparing(TeamMember::teamName);

    public TeamMember {
        Objects.requireNonNull(userName, "userName");
        Objects.requireNonNull(teamName, "teamName");
    }

    @Override
    public TeamMember identity() {
        return this;
    }

    @Override
    public String render() {
        return userName + " (" + userId + ") in team \"" + teamName + "\"";
    }

    @Override
    public int compareTo(TeamMember other) {
        return ORDER.compare(this, other);
    }
}
