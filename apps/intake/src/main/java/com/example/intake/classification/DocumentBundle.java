package com.example.intake.classification;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * A named set of document types that together satisfy one SGK administrative requirement.
 */
public enum DocumentBundle {

    HEARING_DEVICE("hearing_device", EnumSet.of(
            DocumentType.DEVICE_PRESCRIPTION,
            DocumentType.AUDIOGRAM,
            DocumentType.COMPLIANCE_CERTIFICATE)),

    BATTERY("battery", EnumSet.of(DocumentType.BATTERY_PRESCRIPTION));

    private final String code;
    private final Set<DocumentType> requiredTypes;

    DocumentBundle(String code, Set<DocumentType> requiredTypes) {
        this.code = code;
        this.requiredTypes = requiredTypes;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Set<DocumentType> getRequiredTypes() {
        return EnumSet.copyOf(requiredTypes);
    }
}
