package com.example.intake.registry;

import com.example.intake.client.WebClientFactory;
import com.example.intake.common.util.RetryUtils;
import com.example.intake.common.util.StringSanitizer;
import com.example.intake.config.properties.RegistryProperties;
import com.example.intake.exception.ApiException;
import com.example.intake.matching.PatientCandidate;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Patient registry reached over HTTP: {@code GET {searchPath}?q=<query>}.
 */
@Slf4j
@Component
public class RemotePatientRegistrySource implements PatientSource {

    private static final String SERVICE_NAME = "PatientRegistry";

    private final WebClient webClient;
    private final RegistryProperties properties;

    @Autowired
    public RemotePatientRegistrySource(WebClientFactory webClientFactory, RegistryProperties properties) {
        this(webClientFactory.patientRegistryClient(), properties);
    }

    RemotePatientRegistrySource(WebClient webClient, RegistryProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public String name() {
        return RegistryProperties.REMOTE_SOURCE;
    }

    @Override
    @NonNull
    public Mono<List<PatientCandidate>> search(@Nullable String query) {
        String q = query == null ? "" : query;
        log.debug("Searching patient registry for '{}'", StringSanitizer.forLog(q));

        return webClient.get()
                .uri(uriBuilder -> uriBuilder.path(properties.searchPath()).queryParam("q", q).build())
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(),
                        response -> ApiException.fromResponse(SERVICE_NAME, "Patient search failed", response))
                .bodyToMono(RegistrySearchResponse.class)
                .timeout(properties.timeout())
                .retryWhen(RetryUtils.backoff(properties.retry(), "patient registry"))
                .map(RegistrySearchResponse::toCandidates)
                .doOnNext(candidates -> log.debug("Patient registry returned {} candidates", candidates.size()));
    }

    /**
     * Registry wire format. Older registry versions send {@code firstName}/{@code lastName}
     * instead of {@code name}, and {@code tcNumber} for the national id.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record RegistrySearchResponse(List<RegistryPatient> patients) {

        List<PatientCandidate> toCandidates() {
            if (patients == null) {
                return List.of();
            }
            return patients.stream()
                    .filter(patient -> patient.id() != null)
                    .map(RegistryPatient::toCandidate)
                    .toList();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RegistryPatient(
            String id,
            String name,
            String firstName,
            String lastName,
            String tcNumber,
            String phone
    ) {
        PatientCandidate toCandidate() {
            String displayName = name;
            if (displayName == null || displayName.isBlank()) {
                displayName = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
            }
            return new PatientCandidate(id, displayName, tcNumber, phone);
        }
    }
}
