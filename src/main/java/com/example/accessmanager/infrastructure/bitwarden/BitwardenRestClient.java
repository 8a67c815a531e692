package com.example.accessmanager.infrastructure.bitwarden;

import com.example.accessmanager.application.bitwarden.BitwardenStateSource;
import com.example.accessmanager.domain.bitwarden.Group;
import com.example.accessmanager.domain.bitwarden.GroupAccess;
import com.example.accessmanager.domain.bitwarden.GroupCollectionAccess;
import com.example.accessmanager.domain.bitwarden.GroupMember;
import com.example.accessmanager.domain.bitwarden.Member;
import com.example.accessmanager.domain.bitwarden.MemberCollectionAccess;
import com.example.accessmanager.domain.bitwarden.MemberType;
import com.example.accessmanager.domain.bitwarden.VaultCollection;
import com.example.accessmanager.infrastructure.http.RemoteCallExecutor;
import com.example.accessmanager.infrastructure.http.RemoteStateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the actual organization state from the Bitwarden public API.
 */
@Component
public class BitwardenRestClient implements BitwardenStateSource {
    private static final Logger log = LogManager.getLogger(BitwardenRestClient.class);

    private static final ParameterizedTypeReference<BitwardenListResponse<BitwardenMemberDto>> MEMBER_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<BitwardenListResponse<BitwardenGroupDto>> GROUP_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<BitwardenListResponse<BitwardenCollectionDto>>
            COLLECTION_LIST = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<String>> ID_LIST =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final RemoteCallExecutor remoteCallExecutor;

    public BitwardenRestClient(
            @Qualifier("bitwardenApiRestTemplate") RestTemplate restTemplate,
            RemoteCallExecutor remoteCallExecutor) {
        this.restTemplate = restTemplate;
        this.remoteCallExecutor = remoteCallExecutor;
    }

    @Override
    public Set<Member> fetchMembers() {
        Set<Member> members = new HashSet<>();
        for (BitwardenMemberDto member : fetchList("/public/members", MEMBER_LIST)) {
            members.add(toMember(member, "/public/members"));
        }
        return members;
    }

    @Override
    public Set<Group> fetchGroups() {
        Set<Group> groups = new HashSet<>();
        for (BitwardenGroupDto group : fetchList("/public/groups", GROUP_LIST)) {
            groups.add(
                    new Group(
                            required(group.getId(), "group id", "/public/groups"),
                            required(group.getName(), "name of group " + group.getId(), "/public/groups"),
                            group.isAccessAll()));
        }
        return groups;
    }

    @Override
    public Set<GroupMember> fetchGroupMembers(Group group) {
        Set<GroupMember> members = new HashSet<>();
        for (String memberId : fetchMemberIds(group.id())) {
            URI uri = expand("/public/members/{id}", memberId);
            BitwardenMemberDto member =
                    remoteCallExecutor.call(
                            uri.toString(), () -> restTemplate.getForObject(uri, BitwardenMemberDto.class));
            if (member == null) {
                throw new RemoteStateException("No member returned from " + uri);
            }
            members.add(
                    new GroupMember(
                            required(member.getId(), "member id", uri.toString()), nameOf(member), group.name()));
        }
        log.info("Fetched {} members of group {}", members.size(), group.name());
        return members;
    }

    @Override
    public Set<VaultCollection> fetchCollections(Map<String, Member> membersById) {
        Map<String, String> groupNames = new HashMap<>();
        Set<VaultCollection> collections = new HashSet<>();
        for (BitwardenCollectionDto summary : fetchList("/public/collections", COLLECTION_LIST)) {
            String collectionId = required(summary.getId(), "collection id", "/public/collections");
            URI uri = expand("/public/collections/{id}", collectionId);
            BitwardenCollectionDto detail =
                    remoteCallExecutor.call(
                            uri.toString(), () -> restTemplate.getForObject(uri, BitwardenCollectionDto.class));
            if (detail == null) {
                throw new RemoteStateException("No collection returned from " + uri);
            }

            List<GroupCollectionAccess> groupAccess = null;
            List<MemberCollectionAccess> memberAccess = null;
            List<BitwardenCollectionDto.GroupAccessDto> groups =
                    detail.getGroups() != null ? detail.getGroups() : List.of();
            if (!groups.isEmpty()) {
                groupAccess = new ArrayList<>();
                // One entry per member name, however many of the groups grant access.
                Set<MemberCollectionAccess> members = new HashSet<>();
                for (BitwardenCollectionDto.GroupAccessDto access : groups) {
                    String groupName = groupNames.computeIfAbsent(access.getId(), this::fetchGroupName);
                    groupAccess.add(
                            new GroupCollectionAccess(groupName, GroupAccess.fromReadOnly(access.isReadOnly())));
                    for (String memberId : fetchMemberIds(access.getId())) {
                        members.add(new MemberCollectionAccess(memberName(memberId, membersById)));
                    }
                }
                if (!members.isEmpty()) {
                    memberAccess = new ArrayList<>(members);
                }
            }
            collections.add(
                    new VaultCollection(collectionId, summary.getExternalId(), groupAccess, memberAccess));
        }
        return collections;
    }

    private String fetchGroupName(String groupId) {
        URI uri = expand("/public/groups/{id}", groupId);
        BitwardenGroupDto group =
                remoteCallExecutor.call(uri.toString(), () -> restTemplate.getForObject(uri, BitwardenGroupDto.class));
        if (group == null) {
            throw new RemoteStateException("No group returned from " + uri);
        }
        return required(group.getName(), "name of group " + groupId, uri.toString());
    }

    private List<String> fetchMemberIds(String groupId) {
        URI uri = expand("/public/groups/{id}/member-ids", groupId);
        List<String> ids =
                remoteCallExecutor.call(
                        uri.toString(),
                        () -> restTemplate.exchange(uri, HttpMethod.GET, null, ID_LIST).getBody());
        return ids != null ? ids : List.of();
    }

    private <T> List<T> fetchList(
            String path, ParameterizedTypeReference<BitwardenListResponse<T>> type) {
        List<T> result = new ArrayList<>();
        String continuationToken = null;
        do {
            URI uri = pageUri(path, continuationToken);
            BitwardenListResponse<T> page =
                    remoteCallExecutor.call(
                            uri.toString(), () -> restTemplate.exchange(uri, HttpMethod.GET, null, type).getBody());
            if (page == null) {
                break;
            }
            if (page.getData() != null) {
                result.addAll(page.getData());
            }
            continuationToken = page.getContinuationToken();
        } while (continuationToken != null && !continuationToken.isBlank());
        return result;
    }

    private URI pageUri(String path, String continuationToken) {
        URI base = expand(path);
        if (continuationToken == null) {
            return base;
        }
        return UriComponentsBuilder.fromUri(base)
                .queryParam("continuationToken", continuationToken)
                .encode()
                .build()
                .toUri();
    }

    private URI expand(String path, Object... uriVariables) {
        return restTemplate.getUriTemplateHandler().expand(path, uriVariables);
    }

    private static Member toMember(BitwardenMemberDto member, String source) {
        String id = required(member.getId(), "member id", source);
        MemberType type;
        try {
            type = MemberType.fromCode(member.getType());
        } catch (IllegalArgumentException ex) {
            throw new RemoteStateException(
                    "Unknown type " + member.getType() + " of member " + id + " from " + source, 0, false, ex);
        }
        return new Member(id, nameOf(member), Objects.toString(member.getEmail(), ""), type, member.isAccessAll());
    }

    private static String required(String value, String what, String source) {
        if (value == null) {
            throw new RemoteStateException("Missing " + what + " in response from " + source);
        }
        return value;
    }

    // Invited members that have not accepted yet have no name.
    private static String nameOf(BitwardenMemberDto member) {
        return Objects.toString(member.getName(), "");
    }

    private static String memberName(String memberId, Map<String, Member> membersById) {
        Member member = membersById.get(memberId);
        if (member == null) {
            log.warn("Collection access refers to unknown member {}", memberId);
            return memberId;
        }
        return member.name();
    }
}
