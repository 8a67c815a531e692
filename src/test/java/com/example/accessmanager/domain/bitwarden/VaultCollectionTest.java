package com.example.accessmanager.domain.bitwarden;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VaultCollectionTest {

    @Test
    void accessListsAreSortedAndRendered() {
        VaultCollection collection =
                new VaultCollection(
                        "c1",
                        "ext",
                        List.of(
                                new GroupCollectionAccess("group2", GroupAccess.WRITE),
                                new GroupCollectionAccess("group1", GroupAccess.READONLY)),
                        List.of(new MemberCollectionAccess("yunkel"), new MemberCollectionAccess("yan")));

        assertThat(collection.render())
                .isEqualTo(
                        "[[collection]]\n"
                                + "collection_id = \"c1\"\n"
                                + "external_id = \"ext\"\n"
                                + "member_access = [\n"
                                + "  { member_name = \"yan\" },\n"
                                + "  { member_name = \"yunkel\" },\n"
                                + "]\n"
                                + "group_access = [\n"
                                + "  { group_name = \"group1\", access = \"readonly\" },\n"
                                + "  { group_name = \"group2\", access = \"write\" },\n"
                                + "]");
    }

    @Test
    void absentAccessListsDifferFromEmptyOnes() {
        VaultCollection absent = new VaultCollection("c1", "", null, null);
        VaultCollection empty = new VaultCollection("c1", "", List.of(), List.of());

        assertThat(absent).isNotEqualTo(empty);
        assertThat(absent).isLessThan(empty);
        assertThat(absent.render()).isEqualTo("[[collection]]\ncollection_id = \"c1\"\nexternal_id = \"\"");
        assertThat(empty.render()).endsWith("member_access = []\ngroup_access = []");
    }

    @Test
    void equalityIgnoresDeclarationOrderOfAccessEntries() {
        VaultCollection first =
                new VaultCollection(
                        "c1",
                        "",
                        List.of(
                                new GroupCollectionAccess("b", GroupAccess.WRITE),
                                new GroupCollectionAccess("a", GroupAccess.WRITE)),
                        null);
        VaultCollection second =
                new VaultCollection(
                        "c1",
                        "",
                        List.of(
                                new GroupCollectionAccess("a", GroupAccess.WRITE),
                                new GroupCollectionAccess("b", GroupAccess.WRITE)),
                        null);

        assertThat(first).isEqualTo(second);
        assertThat(first.compareTo(second)).isZero();
    }

    @Test
    void memberTypeUsesApiCodes() {
        assertThat(MemberType.fromCode(0)).isEqualTo(MemberType.OWNER);
        assertThat(MemberType.fromCode(2)).isEqualTo(MemberType.USER);
        assertThat(MemberType.fromName("Manager")).isEqualTo(MemberType.MANAGER);
    }
}
