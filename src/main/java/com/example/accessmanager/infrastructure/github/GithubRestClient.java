package com.example.accessmanager.infrastructure.github;

import com.example.accessmanager.application.github.GithubStateSource;
import com.example.accessmanager.domain.github.OrganizationMember;
import com.example.accessmanager.domain.github.OrganizationRole;
import com.example.accessmanager.domain.github.Team;
import com.example.accessmanager.domain.github.TeamMember;
import com.example.accessmanager.infrastructure.http.RemoteCallExecutor;
import com.example.accessmanager.infrastructure.http.RemoteStateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads the actual organization state from the GitHub REST API.
 */
@Component
public class GithubRestClient implements GithubStateSource {
    private static final Logger log = LogManager.getLogger(GithubRestClient.class);

    private final RestTemplate restTemplate;
    private final RemoteCallExecutor remoteCallExecutor;
    private final GithubProperties properties;

    public GithubRestClient(
            @Qualifier("githubRestTemplate") RestTemplate restTemplate,
            RemoteCallExecutor remoteCallExecutor,
            GithubProperties properties) {
        this.restTemplate = restTemplate;
        this.remoteCallExecutor = remoteCallExecutor;
        this.properties = properties;
    }

    @Override
    public Set<OrganizationMember> fetchMembers(String organization) {
        List<GithubUserDto> users = fetchPaged(GithubUserDto[].class, "/orgs/{org}/members", organization);
        AtomicInteger done = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, properties.fetchParallelism()));
        try {
            List<CompletableFuture<OrganizationMember>> futures = new ArrayList<>(users.size());
            for (GithubUserDto user : users) {
                futures.add(
                        CompletableFuture.supplyAsync(
                                () -> {
                                    OrganizationMember member = fetchMember(organization, user);
                                    log.info(
                                            "[{} / {}] Retrieved membership: {}",
                                            done.incrementAndGet(),
                                            users.size(),
                                            user.getLogin());
                                    return member;
                                },
                                pool));
            }
            Set<OrganizationMember> members = new HashSet<>();
            for (CompletableFuture<OrganizationMember> future : futures) {
                members.add(future.join());
            }
            return members;
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        } finally {
            pool.shutdownNow();
        }
    }

    private OrganizationMember fetchMember(String organization, GithubUserDto user) {
        URI uri = expand("/orgs/{org}/memberships/{login}", organization, user.getLogin());
        GithubMembershipDto membership =
                remoteCallExecutor.call(
                        uri.toString(), () -> restTemplate.getForObject(uri, GithubMembershipDto.class));
        if (membership == null || membership.getRole() == null) {
            throw new RemoteStateException("No membership role returned from " + uri);
        }
        return new OrganizationMember(
                user.getId(), user.getLogin(), OrganizationRole.fromValue(membership.getRole()));
    }

    @Override
    public Set<Team> fetchTeams(String organization) {
        Set<Team> teams = new HashSet<>();
        for (GithubTeamDto team : fetchPaged(GithubTeamDto[].class, "/orgs/{org}/teams", organization)) {
            teams.add(
                    new Team(
                            team.getId(),
                            team.getName(),
                            team.getSlug(),
                            team.getDescription(),
                            team.getParent() != null ? team.getParent().getName() : null));
        }
        return teams;
    }

    @Override
    public Set<TeamMember> fetchTeamMembers(String organization, Team team) {
        Set<TeamMember> members = new HashSet<>();
        for (GithubUserDto user :
                fetchPaged(GithubUserDto[].class, "/orgs/{org}/teams/{slug}/members", organization, team.slug())) {
            members.add(new TeamMember(user.getId(), user.getLogin(), team.name()));
        }
        log.info("Fetched {} members of team {}", members.size(), team.name());
        return members;
    }

    private <T> List<T> fetchPaged(Class<T[]> pageType, String path, Object... uriVariables) {
        List<T> result = new ArrayList<>();
        URI next = expand(path + "?per_page=" + properties.pageSize(), uriVariables);
        while (next != null) {
            URI uri = next;
            ResponseEntity<T[]> response =
                    remoteCallExecutor.call(
                            uri.toString(), () -> restTemplate.exchange(uri, HttpMethod.GET, null, pageType));
            T[] page = response.getBody();
            if (page != null) {
                result.addAll(Arrays.asList(page));
            }
            next = GithubPageLinks.next(response.getHeaders().getFirst(HttpHeaders.LINK)).orElse(null);
        }
        return result;
    }

    private URI expand(String path, Object... uriVariables) {
        return restTemplate.getUriTemplateHandler().expand(path, uriVariables);
    }
}
