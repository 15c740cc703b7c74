package com.example.intake.config;

import com.example.intake.classification.DocumentClassifier;
import com.example.intake.extraction.TextExtractor;
import com.example.intake.matching.PatientInfoExtractor;
import com.example.intake.matching.PatientMatcher;
import com.example.intake.observability.IntakeMetrics;
import com.example.intake.pipeline.ArtifactCompressor;
import com.example.intake.pipeline.GzipArtifactCompressor;
import com.example.intake.pipeline.PipelineContext;
import com.example.intake.registry.PatientSourceChain;
import com.example.intake.storage.DocumentRepository;
import com.example.intake.storage.StorageManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the ingestion pipeline's collaborators into a single {@link PipelineContext}.
 */
@Configuration
public class PipelineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ArtifactCompressor artifactCompressor() {
        return new GzipArtifactCompressor();
    }

    @Bean
    public PipelineContext pipelineContext(
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
            Clock clock) {
        return new PipelineContext(textExtractor, classifier, patientInfoExtractor, patientSources, matcher,
                compressor, documentRepository, storageManager, metrics, properties, clock);
    }
}
