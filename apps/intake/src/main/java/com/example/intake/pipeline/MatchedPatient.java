package com.example.intake.pipeline;

/**
 * Patient a document was reconciled to.
 */
public record MatchedPatient(
        String id,
        String name,
        String nationalId,
        double matchConfidence
) {
}
