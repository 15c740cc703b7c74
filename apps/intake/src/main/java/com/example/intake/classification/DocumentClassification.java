package com.example.intake.classification;

/**
 * Outcome of classifying one document's extracted text.
 *
 * @param type       the assigned document type
 * @param confidence heuristic confidence in [0, 1]; 0 for {@link DocumentType#OTHER}
 * @param method     which rule produced the result, kept for audit
 */
public record DocumentClassification(
        DocumentType type,
        double confidence,
        String method
) {
    public static final String METHOD_TEXT_PATTERN = "text_pattern";
    public static final String METHOD_FILENAME_PATTERN = "filename_pattern";
    public static final String METHOD_DEFAULT = "default";
    public static final String METHOD_STORED = "stored";

    public static DocumentClassification unclassified() {
        return new DocumentClassification(DocumentType.OTHER, 0.0, METHOD_DEFAULT);
    }
}
