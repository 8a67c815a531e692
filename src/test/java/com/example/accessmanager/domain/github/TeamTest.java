package com.example.accessmanager.domain.github;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TeamTest {

    @Test
    void slugAndParentAreOnlyRenderedWhenRelevant() {
        Team team = new Team(42, "developers", "developers", "All developers", null);

        assertThat(team.render())
                .isEqualTo(
                        "[[team]]\n"
                                + "github_team_id = 42\n"
                                + "name = \"developers\"\n"
                                + "description = \"All developers\"");
    }

    @Test
    void customSlugAndParentAreRendered() {
        Team team = new Team(7, "Site Reliability", "sre", "On call \"heroes\"", "humans");

        assertThat(team.render())
                .isEqualTo(
                        "[[team]]\n"
                                + "github_team_id = 7\n"
                                + "name = \"Site Reliability\"\n"
                                + "slug = \"sre\"\n"
                                + "description = \"On call \\\"heroes\\\"\"\n"
                                + "parent = \"humans\"");
    }

    @Test
    void missingDescriptionEqualsEmptyDescription() {
        assertThat(new Team(1, "a", "a", null, null)).isEqualTo(new Team(1, "a", "a", "", null));
    }

    @Test
    void ordersByIdThenNameWithAbsentParentFirst() {
        Team root = new Team(1, "a", "a", "", null);
        Team child = new Team(1, "a", "a", "", "p");
        Team other = new Team(2, "a", "a", "", null);

        assertThat(root).isLessThan(child);
        assertThat(child).isLessThan(other);
    }

    @Test
    void membershipIdentityIsTheFullValue() {
        TeamMember member = new TeamMember(583231, "octocat", "developers");

        assertThat(member.identity()).isEqualTo(new TeamMember(583231, "octocat", "developers"));
        assertThat(member.identity()).isNotEqualTo(new TeamMember(583231, "octo", "developers").identity());
        // Names that would collide when joined into one string stay distinct.
        assertThat(new TeamMember(1, "a@b", "c").identity())
                .isNotEqualTo(new TeamMember(1, "a", "b@c").identity());
    }

    @Test
    void memberRendersTomlLayout() {
        OrganizationMember member = new OrganizationMember(583231, "octocat", OrganizationRole.ADMIN);

        assertThat(member.identity()).isEqualTo(583231L);
        assertThat(member.render())
                .isEqualTo(
                        "[[member]]\n"
                                + "github_user_id = 583231\n"
                                + "github_user_name = \"octocat\"\n"
                                + "organization_role = \"admin\"");
    }
}
