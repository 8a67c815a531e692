package com.example.accessmanager.infrastructure.http;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.util.function.Supplier;

/**
 * Runs remote calls, translating client errors into {@link RemoteStateException}
 * and retrying the transient ones.
 */
@Component
public class RemoteCallExecutor {
    private static final Logger log = LogManager.getLogger(RemoteCallExecutor.class);
    static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";

    private final Retry retry;

    public RemoteCallExecutor(HttpProperties properties) {
        RetryConfig config =
                RetryConfig.custom()
                        .maxAttempts(Math.max(1, properties.maxAttempts()))
                        .waitDuration(properties.retryWait())
                        .retryOnException(
                                ex -> ex instanceof RemoteStateException remote && remote.isRetryable())
                        .build();
        this.retry = Retry.of("remote-state", config);
        this.retry
                .getEventPublisher()
                .onRetry(
                        event ->
                                log.warn(
                                        "Retrying remote call (attempt {}): {}",
                                        event.getNumberOfRetryAttempts(),
                                        event.getLastThrowable().getMessage()));
    }

    public <T> T call(String description, Supplier<T> call) {
        return Retry.decorateSupplier(retry, () -> translate(description, call)).get();
    }

    private <T> T translate(String description, Supplier<T> call) {
        try {
            return call.get();
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            throw new RemoteStateException(
                    "Got " + status + " from " + description + ": " + ex.getResponseBodyAsString(),
                    status,
                    isRetryable(status, ex.getResponseHeaders()),
                    ex);
        } catch (ResourceAccessException ex) {
            throw new RemoteStateException("Failed to reach " + description, 0, true, ex);
        }
    }

    static boolean isRetryable(int status, HttpHeaders headers) {
        if (status >= 500 || status == 429) {
            return true;
        }
        return status == 403 && headers != null && "0".equals(headers.getFirst(RATE_LIMIT_REMAINING));
    }
}
