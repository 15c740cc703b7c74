package com.example.intake.pipeline;

/**
 * @param totalProcessed     files that went through the pipeline (skipped and duplicate files excluded)
 * @param withArtifact       files for which a compressed artifact was stored
 * @param totalArtifactBytes combined size of the stored artifacts
 */
public record BatchStatistics(
        int totalProcessed,
        int withArtifact,
        long totalArtifactBytes
) {
}
