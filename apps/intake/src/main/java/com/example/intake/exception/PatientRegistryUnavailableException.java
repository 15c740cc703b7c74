package com.example.intake.exception;

import java.util.List;

/**
 * Every configured patient source failed. Carries one failure description per source, in try order.
 */
public class PatientRegistryUnavailableException extends RuntimeException {

    private final List<String> sourceFailures;

    public PatientRegistryUnavailableException(List<String> sourceFailures) {
        super("All patient sources failed: " + String.join("; ", sourceFailures));
        this.sourceFailures = List.copyOf(sourceFailures);
    }

    public List<String> getSourceFailures() {
        return sourceFailures;
    }
}
