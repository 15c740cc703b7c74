package com.example.intake.exception;

/**
 * The key-value medium rejected a write because it is full.
 */
public class StoreCapacityException extends RuntimeException {

    private final String key;

    public StoreCapacityException(String key, String message) {
        super(message);
        this.key = key;
    }

    public StoreCapacityException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
