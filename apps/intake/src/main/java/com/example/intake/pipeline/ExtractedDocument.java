package com.example.intake.pipeline;

import com.example.intake.classification.DocumentClassification;
import com.example.intake.matching.MatchResult;
import com.example.intake.matching.ReviewReason;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * A processed document as produced by the ingestion pipeline.
 */
@Data
@Builder(toBuilder = true)
public class ExtractedDocument {

    /**
     * Document ID (UUID).
     */
    private String id;

    /**
     * Original filename as provided by the uploader.
     */
    private String fileName;

    private String contentType;

    /**
     * Full OCR text. Truncated only when persisted.
     */
    private String extractedText;

    private double ocrConfidence;

    private DocumentClassification classification;

    private DocumentStatus status;

    private FileStage stage;

    /**
     * Set when the document is reconciled to a patient.
     */
    private MatchedPatient matchedPatient;

    /**
     * Top-ranked candidates considered during matching.
     */
    @Builder.Default
    private List<MatchResult> candidates = List.of();

    /**
     * Why the document needs manual review; null unless status is MANUAL_REVIEW.
     */
    private ReviewReason reviewReason;

    /**
     * Failure description; null unless status is ERROR.
     */
    private String errorMessage;

    private long sizeBytes;

    /**
     * Size of the compressed artifact; 0 when none was produced.
     */
    private long artifactSizeBytes;

    private Instant createdAt;

    private String idempotencyKey;
}
