package com.example.intake.pipeline;

import com.example.intake.classification.DocumentClassifier;
import com.example.intake.config.IntakeProperties;
import com.example.intake.extraction.TextExtractor;
import com.example.intake.matching.PatientInfoExtractor;
import com.example.intake.matching.PatientMatcher;
import com.example.intake.observability.IntakeMetrics;
import com.example.intake.registry.PatientSourceChain;
import com.example.intake.storage.DocumentRepository;
import com.example.intake.storage.StorageManager;

import java.time.Clock;

/**
 * Collaborators of the ingestion pipeline, assembled once at startup.
 */
public record PipelineContext(
        TextExtractor textExtractor,
        DocumentClassifier classifier,
        PatientInfoExtractor patientInfoExtractor,
        PatientSourceChain patientSources,
        PatientMatcher matcher,
        ArtifactCompressor compressor,
        DocumentRepository documentRepository,
        StorageManager storageManager,
        IntakeMetrics metrics,
        IntakeProperties properties,
        Clock clock
) {
}
