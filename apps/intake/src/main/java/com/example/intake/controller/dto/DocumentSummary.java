package com.example.intake.controller.dto;

import com.example.intake.classification.DocumentType;
import com.example.intake.matching.ReviewReason;
import com.example.intake.pipeline.DocumentStatus;
import com.example.intake.storage.StoredDocument;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Stored document without its binary payloads.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentSummary(
        String id,
        String fileName,
        String suggestedName,
        String contentType,
        String patientId,
        String patientName,
        DocumentType documentType,
        String documentTypeLabel,
        double documentTypeConfidence,
        DocumentStatus status,
        ReviewReason reviewReason,
        String errorMessage,
        double matchConfidence,
        long sizeBytes,
        Instant uploadedAt,
        String source,
        boolean hasPayload,
        Instant payloadEvictedAt
) {
    public static DocumentSummary from(StoredDocument document) {
        DocumentType type = document.getDocumentType() == null ? DocumentType.OTHER : document.getDocumentType();
        return new DocumentSummary(
                document.getId(),
                document.getFileName(),
                document.getSuggestedName(),
                document.getContentType(),
                document.getPatientId(),
                document.getPatientName(),
                type,
                type.getLabel(),
                document.getDocumentTypeConfidence(),
                document.getStatus(),
                document.getReviewReason(),
                document.getErrorMessage(),
                document.getMatchConfidence(),
                document.getSizeBytes(),
                document.getUploadedAt(),
                document.getSource(),
                document.hasPayload(),
                document.getPayloadEvictedAt());
    }
}
