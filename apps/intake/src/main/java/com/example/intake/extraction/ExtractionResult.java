package com.example.intake.extraction;

/**
 * Text read from one file.
 *
 * @param text       extracted text, possibly multi-line
 * @param confidence engine confidence in [0, 1]
 */
public record ExtractionResult(String text, double confidence) {

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
