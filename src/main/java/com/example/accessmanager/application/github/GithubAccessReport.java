package com.example.accessmanager.application.github;

import com.example.accessmanager.application.DiffHeaders;
import com.example.accessmanager.application.DiffRenderer;
import com.example.accessmanager.application.StateDiffer;
import com.example.accessmanager.application.StepTimer;
import com.example.accessmanager.domain.DiffResult;
import com.example.accessmanager.domain.github.Organization;
import com.example.accessmanager.domain.github.OrganizationMember;
import com.example.accessmanager.domain.github.Team;
import com.example.accessmanager.domain.github.TeamMember;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Compares a declared GitHub organization against the live organization and
 * renders the differences.
 */
@Service
public class GithubAccessReport {
    private static final Logger log = LogManager.getLogger(GithubAccessReport.class);

    private final GithubTargetLoader targetLoader;
    private final GithubStateSource stateSource;
    private final StateDiffer stateDiffer;
    private final DiffRenderer diffRenderer;

    public GithubAccessReport(
            GithubTargetLoader targetLoader,
            GithubStateSource stateSource,
            StateDiffer stateDiffer,
            DiffRenderer diffRenderer) {
        this.targetLoader = targetLoader;
        this.stateSource = stateSource;
        this.stateDiffer = stateDiffer;
        this.diffRenderer = diffRenderer;
    }

    public List<String> generate(Path configFile) {
        String targetName = configFile.toString();
        Organization target = targetLoader.load(configFile);
        String org = target.name();
        List<String> out = new ArrayList<>();

        StepTimer membersTimer = StepTimer.start();
        Set<OrganizationMember> currentMembers = stateSource.fetchMembers(org);
        log.info("Fetched {} members of {} in {}s", currentMembers.size(), org, membersTimer.elapsedSeconds());
        out.addAll(
                diffRenderer.render(
                        stateDiffer.diff(target.members(), currentMembers),
                        new DiffHeaders(
                                "The following members are specified in " + targetName
                                        + " but not a member of the GitHub organization:",
                                "The following members of the GitHub organization are not specified in "
                                        + targetName + ":",
                                "The following members on GitHub need to be changed to match "
                                        + targetName + ":")));

        StepTimer teamsTimer = StepTimer.start();
        Set<Team> currentTeams = stateSource.fetchTeams(org);
        log.info("Fetched {} teams of {} in {}s", currentTeams.size(), org, teamsTimer.elapsedSeconds());
        out.addAll(
                diffRenderer.render(
                        stateDiffer.diff(target.teams(), currentTeams),
                        new DiffHeaders(
                                "The following teams specified in " + targetName
                                        + " are not present on GitHub:",
                                "The following teams in the GitHub organization are not specified in "
                                        + targetName + ":",
                                "The following teams on GitHub need to be changed to match "
                                        + targetName + ":")));

        // Members are requested through the actual team, the endpoint needs its actual slug.
        Set<String> targetTeamNames = target.teamNames();
        List<Team> existingDesiredTeams =
                currentTeams.stream().filter(team -> targetTeamNames.contains(team.name())).sorted().toList();
        for (Team team : existingDesiredTeams) {
            Set<TeamMember> actualMembers = stateSource.fetchTeamMembers(org, team);
            DiffResult<TeamMember> membersDiff =
                    stateDiffer.diff(target.membershipsOf(team.name()), actualMembers);
            out.addAll(
                    diffRenderer.renderNames(
                            "The following members of team '" + team.name() + "' are not specified in "
                                    + targetName + ", but are present on GitHub:",
                            userNames(membersDiff.toRemove())));
            out.addAll(
                    diffRenderer.renderNames(
                            "The following members of team '" + team.name()
                                    + "' are not members on GitHub, but are specified in " + targetName + ":",
                            userNames(membersDiff.toAdd())));
        }
        return out;
    }

    private static List<String> userNames(List<TeamMember> members) {
        return members.stream().map(TeamMember::userName).toList();
    }
}
