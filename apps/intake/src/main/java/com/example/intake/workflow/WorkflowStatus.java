package com.example.intake.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SGK workflow stage of a patient, in progression order. {@link #BEKLEYEN} and
 * {@link #REDDEDILEN} are terminal states outside the progression.
 * Always derived from the current document set, never stored.
 */
public enum WorkflowStatus {

    SORGULANDI("Sorgulandı", 1),
    RECETE_KAYDEDILDI("Reçete Kaydedildi", 2),
    MALZEME_TESLIM_EDILDI("Malzeme Teslim Edildi", 3),
    BELGELER_YUKLENDI("Belgeler Yüklendi", 4),
    FATURALANDI("Faturalandı", 5),
    ODEMESI_ALINDI("Ödemesi Alındı", 6),
    BEKLEYEN("Bekleyen", 0),
    REDDEDILEN("Reddedilen", -1);

    private final String label;
    private final int stage;

    WorkflowStatus(String label, int stage) {
        this.label = label;
        this.stage = stage;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Position in the progression; 0 for {@link #BEKLEYEN}, negative for {@link #REDDEDILEN}.
     */
    public int getStage() {
        return stage;
    }

    public boolean isTerminal() {
        return this == BEKLEYEN || this == REDDEDILEN;
    }
}
