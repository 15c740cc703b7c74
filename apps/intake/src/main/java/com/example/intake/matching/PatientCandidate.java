package com.example.intake.matching;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.lang.Nullable;

/**
 * Read-only view of a registry patient, as supplied to the matcher.
 */
public record PatientCandidate(
        String id,
        String displayName,
        @Nullable String nationalId,
        @Nullable String phone
) {
    /**
     * Text a free-form query is compared against: name, phone and national id.
     */
    @JsonIgnore
    public String searchableText() {
        StringBuilder text = new StringBuilder(displayName == null ? "" : displayName);
        if (phone != null && !phone.isBlank()) {
            text.append(' ').append(phone);
        }
        if (nationalId != null && !nationalId.isBlank()) {
            text.append(' ').append(nationalId);
        }
        return text.toString();
    }
}
