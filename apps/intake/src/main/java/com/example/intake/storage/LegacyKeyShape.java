package com.example.intake.storage;

/**
 * Layouts used by earlier releases for document keys.
 */
public enum LegacyKeyShape {

    /** JSON array of document records. */
    FLAT_ARRAY,

    /** JSON object mapping a patient id to that patient's array of document records. */
    PATIENT_KEYED_OBJECT
}
