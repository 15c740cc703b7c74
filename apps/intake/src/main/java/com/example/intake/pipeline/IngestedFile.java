package com.example.intake.pipeline;

import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * One uploaded file awaiting processing.
 *
 * @param fileName       original file name
 * @param contentType    MIME type as declared by the uploader
 * @param content        raw bytes
 * @param idempotencyKey client-supplied token; a second file with the same token is not reprocessed
 */
public record IngestedFile(
        String fileName,
        String contentType,
        byte[] content,
        @Nullable String idempotencyKey
) {
    public IngestedFile {
        content = content == null ? new byte[0] : content;
    }

    public static IngestedFile of(String fileName, String contentType, byte[] content) {
        return new IngestedFile(fileName, contentType, content, null);
    }

    public long sizeBytes() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IngestedFile other)) {
            return false;
        }
        return Objects.equals(fileName, other.fileName)
                && Objects.equals(contentType, other.contentType)
                && Arrays.equals(content, other.content)
                && Objects.equals(idempotencyKey, other.idempotencyKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, contentType, Arrays.hashCode(content), idempotencyKey);
    }

    @Override
    public String toString() {
        return "IngestedFile{fileName='" + fileName + "', contentType='" + contentType
                + "', size=" + content.length + "}";
    }
}
