package com.example.intake.controller.dto;

import com.example.intake.storage.StoredDocument;

import java.util.List;

public record DocumentListResponse(
        List<DocumentSummary> documents,
        int totalRecords
) {
    public static DocumentListResponse from(List<StoredDocument> documents) {
        List<DocumentSummary> summaries = documents.stream().map(DocumentSummary::from).toList();
        return new DocumentListResponse(summaries, summaries.size());
    }
}
