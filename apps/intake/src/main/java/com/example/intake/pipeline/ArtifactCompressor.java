package com.example.intake.pipeline;

/**
 * Produces the compact artifact stored next to a document's metadata.
 */
public interface ArtifactCompressor {

    byte[] compress(IngestedFile file);
}
