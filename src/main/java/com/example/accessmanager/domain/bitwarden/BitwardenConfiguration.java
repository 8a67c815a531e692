package com.example.accessmanager.domain.bitwarden;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Declared target state of a Bitwarden organization.
 */
public record BitwardenConfiguration(
        Set<Member> members,
        Set<Group> groups,
        Set<VaultCollection> collections,
        Set<GroupMember> groupMemberships) {
    public BitwardenConfiguration {
        members = Set.copyOf(members);
        groups = Set.copyOf(groups);
        collections = Set.copyOf(collections);
        groupMemberships = Set.copyOf(groupMemberships);
    }

    public Set<String> groupNames() {
        return groups.stream().map(Group::name).collect(Collectors.toSet());
    }

    public Set<GroupMember> membershipsOf(String groupName) {
        return groupMemberships.stream()
                .filter(m -> m.groupName().equals(groupName))
                .collect(Collectors.toSet());
    }
}
