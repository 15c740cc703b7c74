package com.example.intake.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Outcome of one batch. {@code documents} holds one entry per submitted file, in submission order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchResult(
        String batchId,
        List<ExtractedDocument> documents,
        int successCount,
        int errorCount,
        int manualReviewCount,
        int duplicateCount,
        int skippedCount,
        BatchStatistics statistics,
        @Nullable StorageWarning storageWarning,
        boolean cancelled
) {
    public BatchResult {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }
}
