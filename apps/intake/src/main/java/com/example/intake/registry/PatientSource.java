package com.example.intake.registry;

import com.example.intake.matching.PatientCandidate;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A place patient candidates can be fetched from. Implementations signal failure with an error,
 * never with an empty list; an empty list means the source answered and knows no patients.
 */
public interface PatientSource {

    String name();

    Mono<List<PatientCandidate>> search(String query);
}
