package com.example.intake.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Reconciliation status of a processed document.
 */
public enum DocumentStatus {

    /** Still moving through the pipeline. */
    PROCESSING,

    /** Reconciled to a patient without human input. */
    AUTO_MATCHED,

    /** Reconciled to a patient by a user. */
    MANUAL_MATCHED,

    /** Waiting for a user to pick the patient. */
    MANUAL_REVIEW,

    /** Could not be processed; kept in the triage list with the error message. */
    ERROR;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isMatched() {
        return this == AUTO_MATCHED || this == MANUAL_MATCHED;
    }

    @JsonCreator
    public static DocumentStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return MANUAL_REVIEW;
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "processing" -> PROCESSING;
            case "auto_matched", "matched" -> AUTO_MATCHED;
            case "manual_matched" -> MANUAL_MATCHED;
            case "error", "failed" -> ERROR;
            default -> MANUAL_REVIEW;
        };
    }
}
