package com.example.intake.storage;

import com.example.intake.classification.DocumentClassification;
import com.example.intake.classification.DocumentType;
import com.example.intake.matching.ReviewReason;
import com.example.intake.pipeline.DocumentStatus;
import com.example.intake.pipeline.ExtractedDocument;
import com.example.intake.pipeline.FileStage;
import com.example.intake.pipeline.MatchedPatient;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted form of a document, one element of a JSON array stored under a document-list key.
 * Binary payloads are base64 strings and may be evicted by cleanup; metadata never is.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredDocument {

    private String id;

    private String fileName;

    /**
     * Name suggested for export: {@code <patient>_<type>_<yyyy-MM-dd>.<ext>}, ASCII only.
     */
    private String suggestedName;

    private String contentType;

    /**
     * Null while the document sits in the triage list.
     */
    private String patientId;

    private String patientName;

    private DocumentType documentType;

    private double documentTypeConfidence;

    private DocumentStatus status;

    private ReviewReason reviewReason;

    private String errorMessage;

    /**
     * OCR text, truncated on save.
     */
    private String ocrText;

    private double ocrConfidence;

    private double matchConfidence;

    private long sizeBytes;

    private Instant uploadedAt;

    /**
     * Where the record came from: {@code intake_pipeline}, {@code manual} or {@code legacy_migration}.
     */
    private String source;

    private String idempotencyKey;

    private String fileData;

    private String croppedImage;

    @JsonProperty("compressedPDF")
    private String compressedPdf;

    /**
     * Set by cleanup when payloads are stripped, recording which payloads existed.
     */
    private Boolean hasImage;

    @JsonProperty("hasPDF")
    private Boolean hasPdf;

    private Instant payloadEvictedAt;

    @JsonIgnore
    public boolean hasPayload() {
        return fileData != null || croppedImage != null || compressedPdf != null;
    }

    /**
     * Drops binary payloads, keeping every metadata field.
     */
    public StoredDocument withoutPayload(Instant evictedAt) {
        return toBuilder()
                .fileData(null)
                .croppedImage(null)
                .compressedPdf(null)
                .hasImage(croppedImage != null || fileData != null)
                .hasPdf(compressedPdf != null)
                .payloadEvictedAt(evictedAt)
                .build();
    }

    public ExtractedDocument toExtractedDocument() {
        MatchedPatient matchedPatient = patientId == null
                ? null
                : new MatchedPatient(patientId, patientName, null, matchConfidence);
        DocumentType type = documentType == null ? DocumentType.OTHER : documentType;
        return ExtractedDocument.builder()
                .id(id)
                .fileName(fileName)
                .contentType(contentType)
                .extractedText(ocrText)
                .ocrConfidence(ocrConfidence)
                .classification(new DocumentClassification(type, documentTypeConfidence, DocumentClassification.METHOD_STORED))
                .status(status)
                .stage(status == DocumentStatus.ERROR ? FileStage.ERROR : FileStage.PERSISTED)
                .matchedPatient(matchedPatient)
                .reviewReason(reviewReason)
                .errorMessage(errorMessage)
                .sizeBytes(sizeBytes)
                .createdAt(uploadedAt)
                .idempotencyKey(idempotencyKey)
                .build();
    }
}
