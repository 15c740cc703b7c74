package com.example.intake.pipeline;

/**
 * Progress notification emitted after each file of a batch.
 *
 * @param processed  files finished so far, including this one
 * @param total      files in the batch
 * @param fileName   the file just finished
 * @param stage      the stage the file ended in
 * @param success    whether the file was persisted
 * @param statusLine human-readable one-line outcome
 */
public record BatchProgress(
        int processed,
        int total,
        String fileName,
        FileStage stage,
        boolean success,
        String statusLine
) {
}
