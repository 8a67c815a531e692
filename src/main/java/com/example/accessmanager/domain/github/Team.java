package com.example.accessmanager.domain.github;

import com.example.accessmanager.domain.Diffable;
import com.example.accessmanager.domain.TomlText;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A team in the organization. Teams declared before they exist on GitHub
 * have id 0.
 */
public record Team(long teamId, String name, String slug, String description, String parentTeamName)
        implements Diffable<Team, Long> {

    private static final Comparator<Team> ORDER =
            Comparator.comparingLong(Team::teamId)
                    .thenComparing(Team::name)
                    .thenComparing(Team::slug)
                    .thenComparing(Team::description)
                    .thenComparing(
                            Team::parentTeamName, Comparator.nullsFirst(Comparator.naturalOrder()));

    public Team {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(slug, "slug");
        description = description != null ? description : "";
    }

    @Override
    public Long identity() {
        return teamId;
    }

    @Override
    public String render() {
        List<String> lines = new ArrayList<>();
        lines.add("[[team]]");
        lines.add(TomlText.keyValue("github_team_id", teamId));
        lines.add(TomlText.keyValue("name", name));
        // The slug defaults to the name, so it is only listed when they differ.
        if (!slug.equals(name)) {
            lines.add(TomlText.keyValue("slug", slug));
        }
        lines.add(TomlText.keyValue("description", description));
        if (parentTeamName != null) {
            lines.add(TomlText.keyValue("parent", parentTeamName));
        }
        return String.join("\n", lines);
    }

    @Override
    public int compareTo(Team other) {
        return ORDER.compare(this, other);
    }
}
