package com.example.accessmanager.infrastructure.github;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "access-manager.github")
public record GithubProperties(
        String token,
        @DefaultValue("https://api.github.com") String baseUrl,
        @DefaultValue("100") int pageSize,
        @DefaultValue("4") int fetchParallelism) {

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
