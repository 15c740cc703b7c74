package com.example.intake.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.NonNull;

import java.time.Duration;

/**
 * Connection settings for the remote OCR service that turns scans into text.
 */
@ConfigurationProperties(prefix = "intake.ocr")
public record OcrProperties(
        @NonNull String baseUrl,
        @NonNull String extractPath,
        @NonNull Duration timeout,
        @NonNull RetryProperties retry
) {
    public OcrProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8090";
        }
        if (extractPath == null || extractPath.isBlank()) {
            extractPath = "/extract";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(30);
        }
        if (retry == null) {
            retry = RetryProperties.defaults();
        }
    }
}
