package com.example.accessmanager.application.github;

import com.example.accessmanager.domain.github.OrganizationMember;
import com.example.accessmanager.domain.github.Team;
import com.example.accessmanager.domain.github.TeamMember;

import java.util.Set;

/**
 * Actual state of a GitHub organization.
 */
public interface GithubStateSource {
    Set<OrganizationMember> fetchMembers(String organization);

    Set<Team> fetchTeams(String organization);

    /** Members of an existing team; the team must carry its actual slug. */
    Set<TeamMember> fetchTeamMembers(String organization, Team team);
}
