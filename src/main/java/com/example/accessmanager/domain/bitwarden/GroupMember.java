package com.example.accessmanager.domain.bitwarden;

import com.example.accessmanager.domain.Diffable;

import java.util.Comparator;
import java.util.Objects;

/**
 * Membership of an organization member in a group, identified by its full value.
 */
public record GroupMember(String memberId, String memberName, String groupName)
        implements Diffable<GroupMember, GroupMember> {

    private static final Comparator<GroupMember> ORDER =
            Comparator.comparing(GroupMember::memberId)
                    .thenComparing(GroupMember::memberName)
                    .thenComparing(GroupMember::groupName);

    public GroupMember {
        Objects.requireNonNull(memberId, "memberId");
        Objects.requireNonNull(memberName, "memberName");
        Objects.requireNonNull(groupName, "groupName");
    }

    @Override
    public GroupMember identity() {
        return this;
    }

    @Override
    public String render() {
        return memberName + " (" + memberId + ") in group \"" + groupName + "\"";
    }

    @Override
    public int compareTo(GroupMember other) {
        return ORDER.compare(this, other);
    }
}
