package com.example.intake.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.NonNull;

import java.time.Duration;
import java.util.List;

/**
 * Patient registry settings: which sources to consult, in order, and how to reach the remote one.
 */
@ConfigurationProperties(prefix = "intake.registry")
public record RegistryProperties(
        @NonNull List<String> sources,
        @NonNull String baseUrl,
        @NonNull String searchPath,
        @NonNull Duration timeout,
        @NonNull RetryProperties retry,
        @NonNull String snapshotLocation
) {
    public static final String REMOTE_SOURCE = "remote";
    public static final String SNAPSHOT_SOURCE = "snapshot";

    public RegistryProperties {
        if (sources == null || sources.isEmpty()) {
            sources = List.of(REMOTE_SOURCE, SNAPSHOT_SOURCE);
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8091";
        }
        if (searchPath == null || searchPath.isBlank()) {
            searchPath = "/patients/search";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(5);
        }
        if (retry == null) {
            retry = RetryProperties.defaults();
        }
        if (snapshotLocation == null || snapshotLocation.isBlank()) {
            snapshotLocation = "classpath:patients/snapshot.json";
        }
    }
}
