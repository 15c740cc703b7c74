package com.example.intake.exception;

/**
 * Text extraction produced no usable text for a file. Recovered per file inside a batch.
 */
public class ExtractionFailedException extends RuntimeException {

    private final String fileName;

    public ExtractionFailedException(String fileName, String message) {
        super(message);
        this.fileName = fileName;
    }

    public ExtractionFailedException(String fileName, String message, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
