package com.example.intake.registry;

import com.example.intake.common.util.StringSanitizer;
import com.example.intake.config.properties.RegistryProperties;
import com.example.intake.exception.PatientRegistryUnavailableException;
import com.example.intake.matching.ExtractedPatientInfo;
import com.example.intake.matching.PatientCandidate;
import com.example.intake.observability.IntakeMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ordered list of patient sources. Each search tries the sources in order and returns the
 * first successful answer; when every source fails the search errors with
 * {@link PatientRegistryUnavailableException}.
 */
@Slf4j
@Component
public class PatientSourceChain {

    private final List<PatientSource> sources;
    private final IntakeMetrics metrics;

    @Autowired
    public PatientSourceChain(List<PatientSource> availableSources, RegistryProperties properties, IntakeMetrics metrics) {
        this(order(availableSources, properties.sources()), metrics);
    }

    public PatientSourceChain(List<PatientSource> orderedSources, IntakeMetrics metrics) {
        if (orderedSources.isEmpty()) {
            throw new IllegalArgumentException("At least one patient source must be configured");
        }
        this.sources = List.copyOf(orderedSources);
        this.metrics = metrics;
        log.info("Patient source chain: {}", sources.stream().map(PatientSource::name).toList());
    }

    public List<String> sourceNames() {
        return sources.stream().map(PatientSource::name).toList();
    }

    @NonNull
    public Mono<List<PatientCandidate>> search(String query) {
        List<String> failures = Collections.synchronizedList(new ArrayList<>());
        return Flux.fromIterable(sources)
                .concatMap(source -> source.search(query)
                        .map(candidates -> new SourceAnswer(source.name(), candidates))
                        .doOnNext(answer -> metrics.recordRegistryLookup(source.name(), true))
                        .onErrorResume(e -> {
                            metrics.recordRegistryLookup(source.name(), false);
                            log.warn("Patient source '{}' failed for '{}': {}",
                                    source.name(), StringSanitizer.forLog(query), e.getMessage());
                            failures.add(source.name() + ": " + e.getMessage());
                            return Mono.empty();
                        }), 1)
                .next()
                .doOnNext(answer -> log.debug("Patient source '{}' answered with {} candidates",
                        answer.source(), answer.candidates().size()))
                .map(SourceAnswer::candidates)
                .switchIfEmpty(Mono.defer(() -> Mono.error(new PatientRegistryUnavailableException(failures))));
    }

    /**
     * Candidates for a document: the national id and the name are searched separately and the
     * answers merged by patient id, national id hits first. Missing patient info yields no candidates.
     */
    @NonNull
    public Mono<List<PatientCandidate>> candidatesFor(ExtractedPatientInfo info) {
        List<String> queries = new ArrayList<>(2);
        if (info.hasNationalId()) {
            queries.add(info.nationalId());
        }
        if (info.hasName()) {
            queries.add(info.name());
        }
        if (queries.isEmpty()) {
            return Mono.just(List.of());
        }
        return Flux.fromIterable(queries)
                .concatMap(this::search)
                .flatMapIterable(Function.identity())
                .collect(LinkedHashMap<String, PatientCandidate>::new,
                        (merged, candidate) -> merged.putIfAbsent(candidate.id(), candidate))
                .map(merged -> List.copyOf(merged.values()));
    }

    private static List<PatientSource> order(List<PatientSource> available, List<String> names) {
        Map<String, PatientSource> byName = available.stream()
                .collect(Collectors.toMap(PatientSource::name, Function.identity(), (a, b) -> a));
        List<PatientSource> ordered = new ArrayList<>();
        for (String name : names) {
            PatientSource source = byName.get(name);
            if (source == null) {
                log.warn("Configured patient source '{}' is not available, skipping", name);
            } else {
                ordered.add(source);
            }
        }
        return ordered;
    }

    private record SourceAnswer(String source, List<PatientCandidate> candidates) {}
}
