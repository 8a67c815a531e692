package com.example.accessmanager.infrastructure.toml;

import com.example.accessmanager.application.github.GithubTargetLoader;
import com.example.accessmanager.domain.github.Organization;
import com.example.accessmanager.domain.github.OrganizationMember;
import com.example.accessmanager.domain.github.OrganizationRole;
import com.example.accessmanager.domain.github.Team;
import com.example.accessmanager.domain.github.TeamMember;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static com.example.accessmanager.infrastructure.toml.TomlDocuments.optionalLong;
import static com.example.accessmanager.infrastructure.toml.TomlDocuments.optionalText;
import static com.example.accessmanager.infrastructure.toml.TomlDocuments.requiredLong;
import static com.example.accessmanager.infrastructure.toml.TomlDocuments.requiredTable;
import static com.example.accessmanager.infrastructure.toml.TomlDocuments.requiredText;
import static com.example.accessmanager.infrastructure.toml.TomlDocuments.tables;
import static com.example.accessmanager.infrastructure.toml.TomlDocuments.textList;

/**
 * Loads the declared GitHub organization from a TOML file with an
 * {@code [organization]} table and {@code [[team]]} and {@code [[member]]}
 * arrays.
 */
@Component
public class GithubTomlLoader implements GithubTargetLoader {
    private static final Logger log = LogManager.getLogger(GithubTomlLoader.class);

    @Override
    public Organization load(Path file) {
        JsonNode root = TomlDocuments.read(file);
        String name = requiredText(requiredTable(root, "organization"), "name", "[organization]");

        Set<Team> teams = new HashSet<>();
        for (JsonNode table : tables(root, "team")) {
            String teamName = requiredText(table, "name", "[[team]]");
            teams.add(
                    new Team(
                            optionalLong(table, "github_team_id", 0L),
                            teamName,
                            optionalText(table, "slug", teamName),
                            optionalText(table, "description", ""),
                            optionalText(table, "parent", null)));
        }

        Set<OrganizationMember> members = new HashSet<>();
        Set<TeamMember> memberships = new HashSet<>();
        for (JsonNode table : tables(root, "member")) {
            long userId = requiredLong(table, "github_user_id", "[[member]]");
            String userName = requiredText(table, "github_user_name", "[[member]] " + userId);
            members.add(
                    new OrganizationMember(
                            userId,
                            userName,
                            OrganizationRole.fromValue(
                                    requiredText(table, "organization_role", "[[member]] " + userName))));
            for (String teamName : textList(table, "teams")) {
                memberships.add(new TeamMember(userId, userName, teamName));
            }
        }

        log.info(
                "Loaded organization {} from {}: {} members, {} teams",
                name,
                file,
                members.size(),
                teams.size());
        return new Organization(name, members, teams, memberships);
    }
}
