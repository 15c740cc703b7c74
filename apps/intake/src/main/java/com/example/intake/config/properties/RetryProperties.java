package com.example.intake.config.properties;

import org.springframework.lang.NonNull;

import java.time.Duration;

/**
 * Retry configuration shared by the remote collaborators.
 */
public record RetryProperties(
        int maxAttempts,
        @NonNull Duration initialBackoff,
        @NonNull Duration maxBackoff
) {
    public RetryProperties {
        if (maxAttempts <= 0) {
            maxAttempts = 2;
        }
        if (initialBackoff == null) {
            initialBackoff = Duration.ofMillis(200);
        }
        if (maxBackoff == null) {
            maxBackoff = Duration.ofSeconds(2);
        }
    }

    public static RetryProperties defaults() {
        return new RetryProperties(2, Duration.ofMillis(200), Duration.ofSeconds(2));
    }
}
