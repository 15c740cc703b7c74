package com.example.intake.registry;

import com.example.intake.config.properties.RegistryProperties;
import com.example.intake.matching.PatientCandidate;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;

/**
 * Read-only patient snapshot loaded from a JSON resource, used when the remote registry is down.
 * The snapshot is loaded lazily on first search and kept for the lifetime of the source.
 * Filtering is left to the matcher, so every search returns the whole snapshot.
 */
@Slf4j
@Component
public class LocalSnapshotPatientSource implements PatientSource {

    private static final TypeReference<List<PatientCandidate>> CANDIDATE_LIST = new TypeReference<>() {};

    private static final Duration CACHE_FOREVER = Duration.ofMillis(Long.MAX_VALUE);

    private final Mono<List<PatientCandidate>> snapshot;

    public LocalSnapshotPatientSource(
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            RegistryProperties properties) {
        Resource resource = resourceLoader.getResource(properties.snapshotLocation());
        this.snapshot = Mono.fromCallable(() -> load(resource, objectMapper))
                .subscribeOn(Schedulers.boundedElastic())
                // successful loads are kept forever, failures are retried on the next search
                .cache(candidates -> CACHE_FOREVER, error -> Duration.ZERO, () -> Duration.ZERO);
    }

    @Override
    public String name() {
        return RegistryProperties.SNAPSHOT_SOURCE;
    }

    @Override
    public Mono<List<PatientCandidate>> search(String query) {
        return snapshot;
    }

    private static List<PatientCandidate> load(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            throw new IllegalStateException("Patient snapshot not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            List<PatientCandidate> candidates = objectMapper.readValue(in, CANDIDATE_LIST);
            log.info("Loaded {} patients from snapshot {}", candidates.size(), resource.getDescription());
            return candidates;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read patient snapshot " + resource.getDescription(), e);
        }
    }
}
