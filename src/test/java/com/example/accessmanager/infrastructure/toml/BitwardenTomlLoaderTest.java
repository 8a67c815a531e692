package com.example.accessmanager.infrastructure.toml;

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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BitwardenTomlLoaderTest {

    @TempDir
    Path tempDir;

    private final BitwardenTomlLoader loader = new BitwardenTomlLoader();

    @Test
    void loadsMembersGroupsAndCollections() throws IOException {
        Path file =
                write(
                        """
                        [[member]]
                        member_id = "m1"
                        member_name = "yan"
                        email = "yan@example.com"
                        type = "user"
                        groups = ["group1", "group2"]

                        [[member]]
                        member_id = "m2"
                        member_name = "yunkel"
                        email = "yunkel@example.com"
                        type = "owner"
                        access_all = true
                        groups = ["group1"]

                        [[group]]
                        group_id = "g1"
                        group_name = "group1"

                        [[group]]
                        group_id = "g2"
                        group_name = "group2"
                        access_all = true

                        [[collection]]
                        collection_id = "c1"
                        external_id = "collection1"
                        member_access = [
                          { member_name = "yan" },
                        ]
                        group_access = [
                          { group_name = "group2", access = "write" },
                          { group_name = "group1", read_only = true },
                        ]

                        [[collection]]
                        collection_id = "c2"
                        external_id = ""
                        """);

        BitwardenConfiguration configuration = loader.load(file);

        assertThat(configuration.members())
                .containsExactlyInAnyOrder(
                        new Member("m1", "yan", "yan@example.com", MemberType.USER, false),
                        new Member("m2", "yunkel", "yunkel@example.com", MemberType.OWNER, true));
        assertThat(configuration.groups())
                .containsExactlyInAnyOrder(new Group("g1", "group1", false), new Group("g2", "group2", true));
        assertThat(configuration.membershipsOf("group1"))
                .containsExactlyInAnyOrder(
                        new GroupMember("m1", "yan", "group1"), new GroupMember("m2", "yunkel", "group1"));
        assertThat(configuration.collections())
                .containsExactlyInAnyOrder(
                        new VaultCollection(
                                "c1",
                                "collection1",
                                List.of(
                                        new GroupCollectionAccess("group1", GroupAccess.READONLY),
                                        new GroupCollectionAccess("group2", GroupAccess.WRITE)),
                                List.of(new MemberCollectionAccess("yan"))),
                        new VaultCollection("c2", "", null, null));
    }

    @Test
    void groupAccessWithoutLevelIsReported() throws IOException {
        Path file =
                write(
                        """
                        [[collection]]
                        collection_id = "c1"
                        external_id = ""
                        group_access = [ { group_name = "group1" } ]
                        """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("c1");
    }

    @Test
    void missingEmailIsReported() throws IOException {
        Path file =
                write(
                        """
                        [[member]]
                        member_id = "m1"
                        member_name = "yan"
                        type = "user"
                        """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("email");
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("bitwarden.toml");
        Files.writeString(file, content);
        return file;
    }
}
