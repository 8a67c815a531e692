package com.example.accessmanager.application.bitwarden;

import com.example.accessmanager.application.DiffHeaders;
import com.example.accessmanager.application.DiffRenderer;
import com.example.accessmanager.application.StateDiffer;
import com.example.accessmanager.application.StepTimer;
import com.example.accessmanager.domain.DiffResult;
import com.example.accessmanager.domain.bitwarden.BitwardenConfiguration;
import com.example.accessmanager.domain.bitwarden.Group;
import com.example.accessmanager.domain.bitwarden.GroupMember;
import com.example.accessmanager.domain.bitwarden.Member;
import com.example.accessmanager.domain.bitwarden.VaultCollection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compares a declared Bitwarden organization against the live organization
 * and renders the differences.
 */
@Service
public class BitwardenAccessReport {
    private static final Logger log = LogManager.getLogger(BitwardenAccessReport.class);

    private final BitwardenTargetLoader targetLoader;
    private final BitwardenStateSource stateSource;
    private final StateDiffer stateDiffer;
    private final DiffRenderer diffRenderer;

    public BitwardenAccessReport(
            BitwardenTargetLoader targetLoader,
            BitwardenStateSource stateSource,
            StateDiffer stateDiffer,
            DiffRenderer diffRenderer) {
        this.targetLoader = targetLoader;
        this.stateSource = stateSource;
        this.stateDiffer = stateDiffer;
        this.diffRenderer = diffRenderer;
    }

    public List<String> generate(Path configFile) {
        String targetName = configFile.toString();
        BitwardenConfiguration target = targetLoader.load(configFile);
        List<String> out = new ArrayList<>();

        StepTimer membersTimer = StepTimer.start();
        Set<Member> currentMembers = stateSource.fetchMembers();
        log.info("Fetched {} members in {}s", currentMembers.size(), membersTimer.elapsedSeconds());
        out.addAll(
                diffRenderer.render(
                        stateDiffer.diff(target.members(), currentMembers),
                        new DiffHeaders(
                                "The following members are specified in " + targetName
                                        + " but not a member of the Bitwarden organization:",
                                "The following members are not specified in " + targetName
                                        + " but are a member of the Bitwarden organization:",
                                "The following members on Bitwarden need to be changed to match "
                                        + targetName + ":")));

        Map<String, Member> membersById =
                currentMembers.stream().collect(Collectors.toMap(Member::id, Function.identity()));
        StepTimer collectionsTimer = StepTimer.start();
        Set<VaultCollection> currentCollections = stateSource.fetchCollections(membersById);
        log.info(
                "Fetched {} collections in {}s",
                currentCollections.size(),
                collectionsTimer.elapsedSeconds());
        out.addAll(
                diffRenderer.render(
                        stateDiffer.diff(target.collections(), currentCollections),
                        new DiffHeaders(
                                "The following collections are specified in " + targetName
                                        + " but not present in the Bitwarden organization:",
                                "The following collections are not specified in " + targetName
                                        + " but are present in the Bitwarden organization:",
                                "The following collections on Bitwarden need to be changed to match "
                                        + targetName + ":")));

        StepTimer groupsTimer = StepTimer.start();
        Set<Group> currentGroups = stateSource.fetchGroups();
        log.info("Fetched {} groups in {}s", currentGroups.size(), groupsTimer.elapsedSeconds());
        out.addAll(
                diffRenderer.render(
                        stateDiffer.diff(target.groups(), currentGroups),
                        new DiffHeaders(
                                "The following groups specified in " + targetName
                                        + " are not present on Bitwarden:",
                                "The following groups are not specified in " + targetName
                                        + " but are present on Bitwarden:",
                                "The following groups on Bitwarden need to be changed to match "
                                        + targetName + ":")));

        Set<String> targetGroupNames = target.groupNames();
        List<Group> existingDesiredGroups =
                currentGroups.stream().filter(group -> targetGroupNames.contains(group.name())).sorted().toList();
        for (Group group : existingDesiredGroups) {
            DiffResult<GroupMember> membersDiff =
                    stateDiffer.diff(target.membershipsOf(group.name()), stateSource.fetchGroupMembers(group));
            out.addAll(
                    diffRenderer.renderNames(
                            "The following members of group '" + group.name() + "' are not specified in "
                                    + targetName + ", but are present on Bitwarden:",
                            memberNames(membersDiff.toRemove())));
            out.addAll(
                    diffRenderer.renderNames(
                            "The following members of group '" + group.name() + "' are specified in "
                                    + targetName + ", but are not present on Bitwarden:",
                            memberNames(membersDiff.toAdd())));
        }
        return out;
    }

    private static List<String> memberNames(List<GroupMember> members) {
        return members.stream().map(GroupMember::memberName).toList();
    }
}
