package com.example.accessmanager.infrastructure.http;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteCallExecutorTest {

    private final RemoteCallExecutor executor =
            new RemoteCallExecutor(
                    new HttpProperties(3, Duration.ofMillis(10), Duration.ofSeconds(1), Duration.ofSeconds(1)));

    @Test
    void retriesServerErrorsUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        String result =
                executor.call(
                        "/orgs/acme/teams",
                        () -> {
                            if (attempts.incrementAndGet() < 3) {
                                throw new HttpServerErrorException(HttpStatus.BAD_GATEWAY);
                            }
                            return "ok";
                        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void clientErrorsFailWithoutRetry() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(
                        () ->
                                executor.call(
                                        "/orgs/acme/teams",
                                        () -> {
                                            attempts.incrementAndGet();
                                            throw HttpClientErrorException.create(
                                                    HttpStatus.NOT_FOUND,
                                                    "Not Found",
                                                    new HttpHeaders(),
                                                    "{\"message\":\"Not Found\"}".getBytes(StandardCharsets.UTF_8),
                                                    StandardCharsets.UTF_8);
                                        }))
                .isInstanceOf(RemoteStateException.class)
                .hasMessageContaining("404")
                .hasMessageContaining("/orgs/acme/teams")
                .hasMessageContaining("Not Found");
        assertThat(attempts).hasValue(1);
    }

    @Test
    void exhaustedRetriesSurfaceTheLastFailure() {
        assertThatThrownBy(
                        () ->
                                executor.call(
                                        "/public/members",
                                        () -> {
                                            throw new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE);
                                        }))
                .isInstanceOfSatisfying(
                        RemoteStateException.class,
                        ex -> {
                            assertThat(ex.getStatus()).isEqualTo(503);
                            assertThat(ex.isRetryable()).isTrue();
                        });
    }

    @Test
    void exhaustedRateLimitIsRetryable() {
        HttpHeaders exhausted = new HttpHeaders();
        exhausted.add("X-RateLimit-Remaining", "0");
        HttpHeaders remaining = new HttpHeaders();
        remaining.add("X-RateLimit-Remaining", "12");

        assertThat(RemoteCallExecutor.isRetryable(403, exhausted)).isTrue();
        assertThat(RemoteCallExecutor.isRetryable(403, remaining)).isFalse();
        assertThat(RemoteCallExecutor.isRetryable(429, null)).isTrue();
        assertThat(RemoteCallExecutor.isRetryable(401, null)).isFalse();
    }
}
