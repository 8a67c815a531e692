package com.example.accessmanager.infrastructure.http;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "access-manager.http")
public record HttpProperties(
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("2s") Duration retryWait,
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("10s") Duration readTimeout) {}
