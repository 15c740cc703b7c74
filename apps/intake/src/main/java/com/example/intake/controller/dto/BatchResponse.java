package com.example.intake.controller.dto;

import com.example.intake.classification.DocumentType;
import com.example.intake.matching.ReviewReason;
import com.example.intake.pipeline.BatchResult;
import com.example.intake.pipeline.BatchStatistics;
import com.example.intake.pipeline.DocumentStatus;
import com.example.intake.pipeline.ExtractedDocument;
import com.example.intake.pipeline.FileStage;
import com.example.intake.pipeline.StorageWarning;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchResponse(
        String batchId,
        List<ProcessedFile> files,
        int successCount,
        int errorCount,
        int manualReviewCount,
        int duplicateCount,
        int skippedCount,
        BatchStatistics statistics,
        StorageWarning storageWarning,
        boolean cancelled
) {
    public static BatchResponse from(BatchResult result) {
        return new BatchResponse(
                result.batchId(),
                result.documents().stream().map(ProcessedFile::from).toList(),
                result.successCount(),
                result.errorCount(),
                result.manualReviewCount(),
                result.duplicateCount(),
                result.skippedCount(),
                result.statistics(),
                result.storageWarning(),
                result.cancelled());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ProcessedFile(
            String documentId,
            String fileName,
            FileStage stage,
            DocumentStatus status,
            DocumentType documentType,
            Double documentTypeConfidence,
            String patientId,
            String patientName,
            Double matchConfidence,
            ReviewReason reviewReason,
            List<Candidate> candidates,
            String errorMessage
    ) {
        static ProcessedFile from(ExtractedDocument document) {
            var classification = document.getClassification();
            var patient = document.getMatchedPatient();
            return new ProcessedFile(
                    document.getId(),
                    document.getFileName(),
                    document.getStage(),
                    document.getStatus(),
                    classification == null ? null : classification.type(),
                    classification == null ? null : classification.confidence(),
                    patient == null ? null : patient.id(),
                    patient == null ? null : patient.name(),
                    patient == null ? null : patient.matchConfidence(),
                    document.getReviewReason(),
                    document.getCandidates().stream()
                            .map(result -> new Candidate(result.patientId(), result.candidate().displayName(), result.score()))
                            .toList(),
                    document.getErrorMessage());
        }
    }

    public record Candidate(String patientId, String displayName, double score) {}
}
