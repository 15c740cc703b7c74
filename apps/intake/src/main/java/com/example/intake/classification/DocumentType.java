package com.example.intake.classification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of administrative document types the intake pipeline recognizes.
 */
public enum DocumentType {

    DEVICE_PRESCRIPTION("device_prescription", "Cihaz Reçete"),
    BATTERY_PRESCRIPTION("battery_prescription", "Pil Reçete"),
    AUDIOGRAM("audiogram", "Odyogram"),
    COMPLIANCE_CERTIFICATE("compliance_certificate", "Uygunluk Belgesi"),
    ADMINISTRATIVE_REPORT("administrative_report", "SGK Raporu"),
    OTHER("other", "Diğer");

    private final String code;
    private final String label;

    DocumentType(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public boolean isPrescription() {
        return this == DEVICE_PRESCRIPTION || this == BATTERY_PRESCRIPTION;
    }

    /**
     * Resolves a stored code, falling back to {@link #OTHER} for unknown or missing values.
     * Legacy records used Turkish codes ({@code cihaz_recete}, {@code odyogram}, ...), which are accepted too.
     */
    @JsonCreator
    public static DocumentType fromCode(@Nullable String code) {
        if (code == null || code.isBlank()) {
            return OTHER;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseGet(() -> fromLegacyCode(normalized));
    }

    private static DocumentType fromLegacyCode(String code) {
        return switch (code) {
            case "cihaz_recete", "recete" -> DEVICE_PRESCRIPTION;
            case "pil_recete" -> BATTERY_PRESCRIPTION;
            case "odyogram", "odyo" -> AUDIOGRAM;
            case "uygunluk_belgesi", "uygunluk" -> COMPLIANCE_CERTIFICATE;
            case "sgk_raporu", "muayene_raporu" -> ADMINISTRATIVE_REPORT;
            default -> OTHER;
        };
    }
}
