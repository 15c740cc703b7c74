package com.example.intake.storage;

/**
 * A legacy key to migrate and the shape its value is known to have.
 */
public record LegacyKeyDefinition(String key, LegacyKeyShape shape) {
}
