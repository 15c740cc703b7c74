package com.example.intake.common.util;

import com.example.intake.config.properties.RetryProperties;
import com.example.intake.exception.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.util.concurrent.TimeoutException;

/**
 * Retry policy for the remote collaborators.
 */
@Slf4j
public final class RetryUtils {

    private RetryUtils() {}

    /**
     * Server errors, connection failures and timeouts are retried; 4xx answers are not.
     */
    public static boolean isRetryable(@NonNull Throwable throwable) {
        if (throwable instanceof ApiException ex) {
            return ex.isServerError();
        }
        if (throwable instanceof WebClientResponseException ex) {
            return ex.getStatusCode().is5xxServerError();
        }
        return throwable instanceof WebClientRequestException || throwable instanceof TimeoutException;
    }

    /**
     * Exponential backoff over {@link #isRetryable} failures. Once retries are exhausted the last
     * failure is propagated as is, not wrapped.
     */
    @NonNull
    public static RetryBackoffSpec backoff(@NonNull RetryProperties retry, @NonNull String callName) {
        return Retry.backoff(retry.maxAttempts(), retry.initialBackoff())
                .maxBackoff(retry.maxBackoff())
                .filter(RetryUtils::isRetryable)
                .doBeforeRetry(signal -> log.warn("Retrying {} call, attempt {}: {}",
                        callName, signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((backoff, signal) -> signal.failure());
    }
}
