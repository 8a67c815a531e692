package com.example.accessmanager.infrastructure.bitwarden;

import com.example.accessmanager.infrastructure.http.RemoteCallExecutor;
import com.example.accessmanager.infrastructure.http.RemoteStateException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Obtains an organization API token with the OAuth2 client credentials grant
 * and keeps it for the lifetime of the process.
 */
@Component
public class BitwardenTokenProvider {
    private static final Logger log = LogManager.getLogger(BitwardenTokenProvider.class);
    static final String TOKEN_PATH = "/connect/token";

    private final RestTemplate identityRestTemplate;
    private final RemoteCallExecutor remoteCallExecutor;
    private final BitwardenProperties properties;
    private String accessToken;

    public BitwardenTokenProvider(
            @Qualifier("bitwardenIdentityRestTemplate") RestTemplate identityRestTemplate,
            RemoteCallExecutor remoteCallExecutor,
            BitwardenProperties properties) {
        this.identityRestTemplate = identityRestTemplate;
        this.remoteCallExecutor = remoteCallExecutor;
        this.properties = properties;
    }

    public synchronized String accessToken() {
        if (accessToken == null) {
            accessToken = requestToken();
        }
        return accessToken;
    }

    private String requestToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("scope", "api.organization");
        form.add("client_id", properties.clientId());
        form.add("client_secret", properties.clientSecret());

        TokenResponse response =
                remoteCallExecutor.call(
                        properties.identityUrl() + TOKEN_PATH,
                        () ->
                                identityRestTemplate.postForObject(
                                        TOKEN_PATH, new HttpEntity<>(form, headers), TokenResponse.class));
        if (response == null || response.accessToken() == null) {
            throw new RemoteStateException("Failed to fetch Bitwarden API access token");
        }
        log.info("Fetched Bitwarden API access token, expires in {}s", response.expiresIn());
        return response.accessToken();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(
            @JsonProperty("access_token") String accessToken, @JsonProperty("expires_in") Long expiresIn) {}
}
