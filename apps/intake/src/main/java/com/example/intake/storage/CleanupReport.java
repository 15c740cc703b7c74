package com.example.intake.storage;

/**
 * What one cleanup pass freed.
 *
 * @param trimmedDocuments     triage documents dropped beyond the retention count
 * @param strippedPayloads     documents whose binary payload was evicted
 * @param removedTransientKeys expired temp and cache keys removed
 * @param bytesBefore          managed usage before the pass
 * @param bytesAfter           managed usage after the pass
 */
public record CleanupReport(
        int trimmedDocuments,
        int strippedPayloads,
        int removedTransientKeys,
        long bytesBefore,
        long bytesAfter
) {
    public long freedBytes() {
        return Math.max(0, bytesBefore - bytesAfter);
    }
}
