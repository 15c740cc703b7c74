package com.example.intake.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Per-file progress through the pipeline: QUEUED, EXTRACTING, CLASSIFYING, MATCHING, then
 * PERSISTED or ERROR. SKIPPED marks files never started because the batch was cancelled.
 */
public enum FileStage {
    QUEUED,
    EXTRACTING,
    CLASSIFYING,
    MATCHING,
    PERSISTED,
    ERROR,
    SKIPPED;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
