package com.example.accessmanager.infrastructure.bitwarden;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "access-manager.bitwarden")
public record BitwardenProperties(
        String clientId,
        String clientSecret,
        @DefaultValue("https://identity.bitwarden.com") String identityUrl,
        @DefaultValue("https://api.bitwarden.com") String apiUrl) {

    public boolean hasClientId() {
        return clientId != null && !clientId.isBlank();
    }

    public boolean hasClientSecret() {
        return clientSecret != null && !clientSecret.isBlank();
    }
}
