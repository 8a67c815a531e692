package com.example.accessmanager.infrastructure.toml;

import com.example.accessmanager.application.bitwarden.BitwardenTargetLoader;
import com.example.accessmanager.domain.ConfigurationException;
import com.example.accessmanager.domain.bitwarden.BitwardenConfiguration;
import com.example.accessmanager.domain.bitwarden.Group;
import com.example.accessmanager.domain.bitwarden.GroupAccess;
import com.example.accessmanager.domain.bitwarden.GroupCollectionAccess;
import com.example.accessmanager.domain.bitwarden.GroupMember;
import com.example.accessmanager.domain.bitwarden.Member;
import com.example.accessmanager.domain.bitwarden.MemberCollectionAccess;
import com.example.accessmanager.domain.bitwarden.MemberType;
import com.example.accessmanager.domain.bitwarden.VaultCollection;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.example.accessmanager.infrastructure.toml.TomlDocuments.optionalBoolean;
import static com.example.accessmanager.infrastructure.toml.TomlDocuments.optionalText;
import static com.example.accessmanager.infrastructure.toml.TomlDocuments.requiredText;
import static com.example.accessmanager.infrastructure.toml.TomlDocuments.tables;
import static com.example.accessmanager.infrastructure.toml.TomlDocuments.textList;

/**
 * Loads the declared Bitwarden organization from a TOML file with
 * {@code [[member]]}, {@code [[group]]} and {@code [[collection]]} arrays.
 */
@Component
public class BitwardenTomlLoader implements BitwardenTargetLoader {
    private static final Logger log = LogManager.getLogger(BitwardenTomlLoader.class);

    @Override
    public BitwardenConfiguration load(Path file) {
        JsonNode root = TomlDocuments.read(file);

        Set<Member> members = new HashSet<>();
        Set<GroupMember> memberships = new HashSet<>();
        for (JsonNode table : tables(root, "member")) {
            String id = requiredText(table, "member_id", "[[member]]");
            String name = requiredText(table, "member_name", "[[member]] " + id);
            members.add(
                    new Member(
                            id,
                            name,
                            requiredText(table, "email", "[[member]] " + name),
                            MemberType.fromName(requiredText(table, "type", "[[member]] " + name)),
                            optionalBoolean(table, "access_all", false)));
            for (String groupName : textList(table, "groups")) {
                memberships.add(new GroupMember(id, name, groupName));
            }
        }

        Set<Group> groups = new HashSet<>();
        for (JsonNode table : tables(root, "group")) {
            String id = requiredText(table, "group_id", "[[group]]");
            groups.add(
                    new Group(
                            id,
                            requiredText(table, "group_name", "[[group]] " + id),
                            optionalBoolean(table, "access_all", false)));
        }

        Set<VaultCollection> collections = new HashSet<>();
        for (JsonNode table : tables(root, "collection")) {
            collections.add(readCollection(table));
        }

        log.info(
                "Loaded Bitwarden configuration from {}: {} members, {} groups, {} collections",
                file,
                members.size(),
                groups.size(),
                collections.size());
        return new BitwardenConfiguration(members, groups, collections, memberships);
    }

    private VaultCollection readCollection(JsonNode table) {
        String id = requiredText(table, "collection_id", "[[collection]]");
        String context = "[[collection]] " + id;

        List<MemberCollectionAccess> memberAccess = null;
        if (table.has("member_access")) {
            memberAccess = new ArrayList<>();
            for (JsonNode entry : tables(table, "member_access")) {
                memberAccess.add(new MemberCollectionAccess(requiredText(entry, "member_name", context)));
            }
        }

        List<GroupCollectionAccess> groupAccess = null;
        if (table.has("group_access")) {
            groupAccess = new ArrayList<>();
            for (JsonNode entry : tables(table, "group_access")) {
                groupAccess.add(
                        new GroupCollectionAccess(
                                requiredText(entry, "group_name", context), readGroupAccess(entry, context)));
            }
        }

        return new VaultCollection(id, optionalText(table, "external_id", ""), groupAccess, memberAccess);
    }

    private GroupAccess readGroupAccess(JsonNode entry, String context) {
        if (entry.has("access")) {
            return GroupAccess.fromName(entry.get("access").asText());
        }
        if (entry.has("read_only")) {
            return GroupAccess.fromReadOnly(optionalBoolean(entry, "read_only", false));
        }
        throw new ConfigurationException("Missing 'access' or 'read_only' in group_access of " + context);
    }
}
