package com.example.accessmanager.application.bitwarden;

import com.example.accessmanager.domain.bitwarden.BitwardenConfiguration;

import java.nio.file.Path;

public interface BitwardenTargetLoader {
    BitwardenConfiguration load(Path file);
}
