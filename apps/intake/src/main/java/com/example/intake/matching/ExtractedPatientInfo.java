package com.example.intake.matching;

import org.springframework.lang.Nullable;

import java.time.LocalDate;

/**
 * Patient identifying fields found in a document's text. Any field may be missing.
 */
public record ExtractedPatientInfo(
        @Nullable String nationalId,
        @Nullable String name,
        @Nullable LocalDate birthDate,
        @Nullable String phone,
        double confidence
) {
    public static ExtractedPatientInfo empty() {
        return new ExtractedPatientInfo(null, null, null, null, 0.0);
    }

    public boolean hasNationalId() {
        return nationalId != null && !nationalId.isBlank();
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public boolean isEmpty() {
        return !hasNationalId() && !hasName();
    }
}
