package com.example.accessmanager.application.github;

import com.example.accessmanager.domain.github.Organization;

import java.nio.file.Path;

public interface GithubTargetLoader {
    Organization load(Path file);
}
