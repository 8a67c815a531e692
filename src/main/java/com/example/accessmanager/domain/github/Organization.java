package com.example.accessmanager.domain.github;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Declared target state of a GitHub organization.
 */
public record Organization(
        String name, Set<OrganizationMember> members, Set<Team> teams, Set<TeamMember> teamMemberships) {
    public Organization {
        Objects.requireNonNull(name, "name");
        members = Set.copyOf(members);
        teams = Set.copyOf(teams);
        teamMemberships = Set.copyOf(teamMemberships);
    }

    public Set<String> teamNames() {
        return teams.stream().map(Team::name).collect(Collectors.toSet());
    }

    public Set<TeamMember> membershipsOf(String teamName) {
        return teamMemberships.stream()
                .filter(m -> m.teamName().equals(teamName))
                .collect(Collectors.toSet());
    }
}
