package com.example.intake.exception;

/**
 * A write could not be completed even after cleanup and one retry.
 */
public class QuotaExceededException extends RuntimeException {

    private final String key;
    private final long usedBytes;
    private final long limitBytes;

    public QuotaExceededException(String key, long usedBytes, long limitBytes) {
        super("Storage quota exceeded even after cleanup (used " + usedBytes + " of " + limitBytes + " bytes)");
        this.key = key;
        this.usedBytes = usedBytes;
        this.limitBytes = limitBytes;
    }

    public String getKey() {
        return key;
    }

    public long getUsedBytes() {
        return usedBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }
}
