package com.example.accessmanager.infrastructure.github;

import java.net.URI;
import java.util.Optional;

/**
 * Reads the {@code Link} response header GitHub uses for pagination.
 */
final class GithubPageLinks {
    private GithubPageLinks() {}

    static Optional<URI> next(String linkHeader) {
        if (linkHeader == null || linkHeader.isBlank()) {
            return Optional.empty();
        }
        for (String link : linkHeader.split(",")) {
            String[] parts = link.split(";");
            String target = parts[0].trim();
            if (!target.startsWith("<") || !target.endsWith(">")) {
                continue;
            }
            for (int i = 1; i < parts.length; i++) {
                String param = parts[i].trim().replace(" ", "");
                if (param.equals("rel=\"next\"") || param.equals("rel=next")) {
                    return Optional.of(URI.create(target.substring(1, target.length() - 1)));
                }
            }
        }
        return Optional.empty();
    }
}
