package com.example.accessmanager.application.bitwarden;

import com.example.accessmanager.domain.bitwarden.Group;
import com.example.accessmanager.domain.bitwarden.GroupMember;
import com.example.accessmanager.domain.bitwarden.Member;
import com.example.accessmanager.domain.bitwarden.VaultCollection;

import java.util.Map;
import java.util.Set;

/**
 * Actual state of a Bitwarden organization.
 */
public interface BitwardenStateSource {
    Set<Member> fetchMembers();

    Set<Group> fetchGroups();

    Set<GroupMember> fetchGroupMembers(Group group);

    /**
     * @param membersById organization members, used to resolve member names of
     *     collection access
     */
    Set<VaultCollection> fetchCollections(Map<String, Member> membersById);
}
