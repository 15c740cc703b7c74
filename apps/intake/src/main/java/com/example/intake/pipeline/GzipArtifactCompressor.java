package com.example.intake.pipeline;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPOutputStream;

public class GzipArtifactCompressor implements ArtifactCompressor {

    @Override
    public byte[] compress(IngestedFile file) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(32, file.content().length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(file.content());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress " + file.fileName(), e);
        }
        return buffer.toByteArray();
    }
}
