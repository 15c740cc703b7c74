package com.example.intake.extraction;

import com.example.intake.pipeline.IngestedFile;
import reactor.core.publisher.Mono;

/**
 * Turns an uploaded scan or PDF into text.
 */
public interface TextExtractor {

    Mono<ExtractionResult> extract(IngestedFile file);
}
