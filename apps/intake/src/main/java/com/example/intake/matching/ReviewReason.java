package com.example.intake.matching;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a document could not be reconciled automatically.
 */
public enum ReviewReason {

    NO_PATIENT_INFO("Belgede hasta adı veya TC kimlik no bulunamadı"),
    NO_CANDIDATES("Eşleşecek hasta kaydı yok"),
    BELOW_THRESHOLD("Eşleşme güveni eşiğin altında"),
    TOO_CLOSE_TO_CALL("Birden fazla hasta benzer skorla eşleşti"),
    REGISTRY_UNAVAILABLE("Hasta kayıt sistemine ulaşılamadı");

    private final String description;

    ReviewReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
