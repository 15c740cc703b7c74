package com.example.intake.registry;

import com.example.intake.config.properties.RegistryProperties;
import com.example.intake.matching.PatientCandidate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LocalSnapshotPatientSource")
class LocalSnapshotPatientSourceTest {

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();

    private LocalSnapshotPatientSource sourceFor(String location) {
        RegistryProperties properties = new RegistryProperties(
                List.of(RegistryProperties.SNAPSHOT_SOURCE), null, null, null, null, location);
        return new LocalSnapshotPatientSource(new DefaultResourceLoader(), objectMapper, properties);
    }

    @Test
    @DisplayName("should return the whole snapshot for any query")
    void shouldReturnWholeSnapshot() {
        LocalSnapshotPatientSource source = sourceFor("classpath:patients/test-snapshot.json");

        StepVerifier.create(source.search("anything"))
                .assertNext(candidates -> {
                    assertThat(candidates).extracting(PatientCandidate::id).containsExactly("t-1", "t-2");
                    assertThat(candidates.get(0).displayName()).isEqualTo("Ali Yılmaz");
                    assertThat(candidates.get(0).nationalId()).isEqualTo("12345678901");
                })
                .verifyComplete();
        assertThat(source.name()).isEqualTo(RegistryProperties.SNAPSHOT_SOURCE);
    }

    @Test
    @DisplayName("should fail each search while the snapshot is missing")
    void shouldFailWhenSnapshotMissing() {
        LocalSnapshotPatientSource source = sourceFor("classpath:patients/missing.json");

        StepVerifier.create(source.search("Ali"))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(IllegalStateException.class)
                        .hasMessageContaining("Patient snapshot not found"))
                .verify();
        StepVerifier.create(source.search("Ali"))
                .expectError(IllegalStateException.class)
                .verify();
    }
}
