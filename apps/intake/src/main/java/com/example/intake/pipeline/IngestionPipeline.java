package com.example.intake.pipeline;

import com.example.intake.classification.DocumentClassification;
import com.example.intake.common.util.DocumentNames;
import com.example.intake.common.util.StringSanitizer;
import com.example.intake.config.IntakeProperties;
import com.example.intake.exception.ExtractionFailedException;
import com.example.intake.exception.PatientRegistryUnavailableException;
import com.example.intake.exception.QuotaExceededException;
import com.example.intake.extraction.ExtractionResult;
import com.example.intake.matching.ExtractedPatientInfo;
import com.example.intake.matching.MatchDecision;
import com.example.intake.matching.MatchResult;
import com.example.intake.matching.ReviewReason;
import com.example.intake.storage.StoredDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Takes a batch of uploaded files through extraction, classification, patient matching and
 * persistence, one file at a time and in submission order.
 * <p>
 * A failing file never fails the batch: extraction failures are persisted to the triage list as
 * {@link DocumentStatus#ERROR} documents, validation and quota failures are reported only.
 * Cancellation is observed between files.
 */
@Slf4j
@Component
public class IngestionPipeline {

    static final String SOURCE = "intake_pipeline";
    private static final String CHECKPOINT_PREFIX = "batch-";

    private final PipelineContext context;
    private final IntakeProperties.Pipeline settings;
    private final IntakeProperties.Storage storageSettings;

    public IngestionPipeline(PipelineContext context) {
        this.context = context;
        this.settings = context.properties().getPipeline();
        this.storageSettings = context.properties().getStorage();
    }

    @NonNull
    public Mono<BatchResult> ingest(@NonNull List<IngestedFile> files) {
        return ingest(files, BatchProgressListener.noop(), new BatchCancellation());
    }

    @NonNull
    public Mono<BatchResult> ingest(@NonNull List<IngestedFile> files,
                                    @NonNull BatchProgressListener listener,
                                    @NonNull BatchCancellation cancellation) {
        return Mono.defer(() -> {
            String batchId = UUID.randomUUID().toString();
            String checkpointKey = context.storageManager().tempKey(CHECKPOINT_PREFIX + batchId);
            int total = files.size();
            AtomicInteger processed = new AtomicInteger();
            log.info("Batch {} started with {} files", batchId, total);

            return Flux.fromIterable(files)
                    .concatMap(file -> {
                        if (cancellation.isCancelled()) {
                            return Mono.just(FileOutcome.skipped(skippedDocument(file)));
                        }
                        return processFile(file)
                                .doOnNext(outcome -> listener.onProgress(progress(
                                        processed.incrementAndGet(), total, outcome)))
                                .flatMap(outcome -> writeCheckpoint(checkpointKey, processed.get(), total)
                                        .thenReturn(outcome));
                    })
                    .collectList()
                    .flatMap(outcomes -> removeCheckpoint(checkpointKey)
                            .then(Mono.defer(() -> complete(batchId, outcomes, cancellation.isCancelled()))));
        });
    }

    // ---- per file ----

    private Mono<FileOutcome> processFile(IngestedFile file) {
        String token = file.idempotencyKey();
        if (token == null || token.isBlank()) {
            return processNewFile(file);
        }
        return context.documentRepository().findByIdempotencyKey(token)
                .map(stored -> {
                    context.metrics().recordDuplicateSkipped();
                    log.info("File {} already persisted as document {}, not reprocessing",
                            StringSanitizer.forLog(file.fileName()), stored.getId());
                    return FileOutcome.duplicate(stored.toExtractedDocument());
                })
                .switchIfEmpty(Mono.defer(() -> processNewFile(file)));
    }

    private Mono<FileOutcome> processNewFile(IngestedFile file) {
        ExtractedDocument queued = ExtractedDocument.builder()
                .id(UUID.randomUUID().toString())
                .fileName(file.fileName())
                .contentType(file.contentType())
                .status(DocumentStatus.PROCESSING)
                .stage(FileStage.QUEUED)
                .sizeBytes(file.sizeBytes())
                .createdAt(context.clock().instant())
                .idempotencyKey(file.idempotencyKey())
                .build();

        String violation = validate(file);
        if (violation != null) {
            log.warn("Rejected file {}: {}", StringSanitizer.forLog(file.fileName()), violation);
            return Mono.just(FileOutcome.processed(failed(queued, violation)));
        }

        return extract(file, queued)
                .flatMap(extraction -> classifyAndMatch(file, queued, extraction))
                .onErrorResume(ExtractionFailedException.class, e -> persistExtractionFailure(queued, e))
                .onErrorResume(QuotaExceededException.class, e -> {
                    log.warn("File {} not stored: {}", StringSanitizer.forLog(file.fileName()), e.getMessage());
                    return Mono.just(FileOutcome.processed(failed(queued, e.getMessage())));
                })
                .onErrorResume(e -> {
                    log.error("Unexpected failure processing {}: {}", StringSanitizer.forLog(file.fileName()), e.getMessage(), e);
                    return Mono.just(FileOutcome.processed(failed(queued, e.getMessage())));
                })
                .doOnNext(outcome -> context.metrics().recordDocumentProcessed(
                        outcome.document().getStatus(), file.sizeBytes()));
    }

    @Nullable
    private String validate(IngestedFile file) {
        if (file.sizeBytes() == 0) {
            return "File is empty";
        }
        if (file.sizeBytes() > settings.getMaxFileSizeBytes()) {
            return "File is larger than " + settings.getMaxFileSizeBytes() / (1024 * 1024) + " MB";
        }
        String contentType = file.contentType() == null ? "" : file.contentType().toLowerCase(Locale.ROOT);
        if (!settings.getSupportedContentTypes().contains(contentType)) {
            return "Unsupported file type: " + file.contentType();
        }
        return null;
    }

    private Mono<ExtractionResult> extract(IngestedFile file, ExtractedDocument queued) {
        log.debug("Document {} {} -> {}", queued.getId(), FileStage.QUEUED, FileStage.EXTRACTING);
        return Mono.defer(() -> context.textExtractor().extract(file))
                .timeout(settings.getExtractionTimeout())
                .onErrorMap(e -> !(e instanceof ExtractionFailedException),
                        e -> new ExtractionFailedException(file.fileName(), "Text extraction failed: " + e.getMessage(), e))
                .filter(result -> !result.isBlank())
                .switchIfEmpty(Mono.error(() -> new ExtractionFailedException(file.fileName(), "No text found in document")));
    }

    private Mono<FileOutcome> classifyAndMatch(IngestedFile file, ExtractedDocument queued, ExtractionResult extraction) {
        log.debug("Document {} {} -> {}", queued.getId(), FileStage.EXTRACTING, FileStage.CLASSIFYING);
        DocumentClassification classification = context.classifier().classify(extraction.text(), file.fileName());
        ExtractedPatientInfo info = context.patientInfoExtractor().extract(extraction.text());

        log.debug("Document {} {} -> {}", queued.getId(), FileStage.CLASSIFYING, FileStage.MATCHING);
        return context.patientSources().candidatesFor(info)
                .map(candidates -> context.matcher().match(info, candidates))
                .onErrorResume(PatientRegistryUnavailableException.class, e -> {
                    log.warn("Patient registry unavailable for document {}, sending to manual review: {}",
                            queued.getId(), e.getSourceFailures());
                    return Mono.just(MatchDecision.manualReview(ReviewReason.REGISTRY_UNAVAILABLE, List.of()));
                })
                .flatMap(decision -> persistMatched(file, queued.toBuilder()
                        .extractedText(extraction.text())
                        .ocrConfidence(extraction.confidence())
                        .classification(classification)
                        .candidates(decision.candidates())
                        .build(), decision));
    }

    private Mono<FileOutcome> persistMatched(IngestedFile file, ExtractedDocument classified, MatchDecision decision) {
        return Mono.fromCallable(() -> context.compressor().compress(file))
                .flatMap(artifact -> {
                    context.metrics().recordArtifact(artifact.length);
                    MatchedPatient patient = decision.isAutoMatched() ? toMatchedPatient(decision.match()) : null;
                    ExtractedDocument document = classified.toBuilder()
                            .status(patient != null ? DocumentStatus.AUTO_MATCHED : DocumentStatus.MANUAL_REVIEW)
                            .matchedPatient(patient)
                            .reviewReason(decision.reviewReason())
                            .artifactSizeBytes(artifact.length)
                            .stage(FileStage.PERSISTED)
                            .build();

                    StoredDocument stored = toStored(document).toBuilder()
                            .compressedPdf(Base64.getEncoder().encodeToString(artifact))
                            .hasPdf(true)
                            .build();
                    return context.documentRepository().saveDocument(stored)
                            .then(rememberIdempotencyKey(document))
                            .doOnSuccess(ignored -> log.info("Stored document {} ({}, {}{})",
                                    document.getId(),
                                    document.getClassification().type().getCode(),
                                    document.getStatus().getCode(),
                                    patient != null ? ", patient " + patient.id() : ""))
                            .thenReturn(FileOutcome.processed(document));
                });
    }

    private Mono<FileOutcome> persistExtractionFailure(ExtractedDocument queued, ExtractionFailedException e) {
        context.metrics().recordExtractionFailure();
        log.warn("Extraction failed for {}: {}", StringSanitizer.forLog(e.getFileName()), e.getMessage());
        ExtractedDocument document = failed(queued, e.getMessage());
        return context.documentRepository().saveDocument(toStored(document))
                .thenReturn(FileOutcome.processed(document));
    }

    private Mono<Void> rememberIdempotencyKey(ExtractedDocument document) {
        String token = document.getIdempotencyKey();
        if (token == null || token.isBlank()) {
            return Mono.empty();
        }
        // findByIdempotencyKey falls back to the token on the stored document
        return context.documentRepository().rememberIdempotencyKey(token, document.getId())
                .onErrorResume(e -> {
                    log.warn("Idempotency token record for document {} not written: {}", document.getId(), e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Void> writeCheckpoint(String key, int processed, int total) {
        return context.storageManager().put(key, processed + "/" + total)
                .onErrorResume(e -> {
                    log.warn("Batch checkpoint {} not written: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Void> removeCheckpoint(String key) {
        return context.storageManager().remove(key)
                .then()
                .onErrorResume(e -> {
                    log.warn("Batch checkpoint {} not removed: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    // ---- completion ----

    private Mono<BatchResult> complete(String batchId, List<FileOutcome> outcomes, boolean cancelled) {
        int success = 0;
        int errors = 0;
        int manualReview = 0;
        int duplicates = 0;
        int skipped = 0;
        int totalProcessed = 0;
        int withArtifact = 0;
        long artifactBytes = 0;
        for (FileOutcome outcome : outcomes) {
            ExtractedDocument document = outcome.document();
            if (outcome.skipped()) {
                skipped++;
                continue;
            }
            if (outcome.duplicate()) {
                duplicates++;
                continue;
            }
            totalProcessed++;
            if (document.getStatus() == DocumentStatus.ERROR) {
                errors++;
                continue;
            }
            success++;
            if (document.getStatus() == DocumentStatus.MANUAL_REVIEW) {
                manualReview++;
            }
            if (document.getArtifactSizeBytes() > 0) {
                withArtifact++;
                artifactBytes += document.getArtifactSizeBytes();
            }
        }

        BatchStatistics statistics = new BatchStatistics(totalProcessed, withArtifact, artifactBytes);
        List<ExtractedDocument> documents = outcomes.stream().map(FileOutcome::document).toList();
        int successCount = success;
        int errorCount = errors;
        int manualReviewCount = manualReview;
        int duplicateCount = duplicates;
        int skippedCount = skipped;

        context.metrics().recordBatch(cancelled);
        log.info("Batch {} {}: success={}, errors={}, manualReview={}, duplicates={}, skipped={}",
                batchId, cancelled ? "cancelled" : "completed", success, errors, manualReview, duplicates, skipped);

        return context.storageManager().checkQuota()
                .filter(quota -> quota.percentage() >= storageSettings.getWarningRatio() * 100)
                .map(StorageWarning::of)
                .onErrorResume(e -> {
                    log.warn("Quota check after batch {} failed: {}", batchId, e.getMessage());
                    return Mono.empty();
                })
                .map(warning -> new BatchResult(batchId, documents, successCount, errorCount, manualReviewCount,
                        duplicateCount, skippedCount, statistics, warning, cancelled))
                .defaultIfEmpty(new BatchResult(batchId, documents, successCount, errorCount, manualReviewCount,
                        duplicateCount, skippedCount, statistics, null, cancelled));
    }

    // ---- mapping ----

    private BatchProgress progress(int processed, int total, FileOutcome outcome) {
        ExtractedDocument document = outcome.document();
        boolean success = document.getStatus() != DocumentStatus.ERROR;
        return new BatchProgress(processed, total, document.getFileName(), document.getStage(), success,
                statusLine(document, outcome.duplicate()));
    }

    static String statusLine(ExtractedDocument document, boolean duplicate) {
        if (document.getStatus() == DocumentStatus.ERROR) {
            return "✗ " + document.getFileName() + ": " + document.getErrorMessage();
        }
        if (duplicate) {
            return "✓ " + document.getFileName() + " zaten kayıtlı";
        }
        long bytes = document.getArtifactSizeBytes() > 0 ? document.getArtifactSizeBytes() : document.getSizeBytes();
        return String.format(Locale.ROOT, "✓ %s kaydedildi (%.1f KB)", document.getFileName(), bytes / 1024.0);
    }

    private static ExtractedDocument failed(ExtractedDocument document, String message) {
        return document.toBuilder()
                .status(DocumentStatus.ERROR)
                .stage(FileStage.ERROR)
                .errorMessage(message)
                .build();
    }

    private ExtractedDocument skippedDocument(IngestedFile file) {
        return ExtractedDocument.builder()
                .fileName(file.fileName())
                .contentType(file.contentType())
                .stage(FileStage.SKIPPED)
                .sizeBytes(file.sizeBytes())
                .idempotencyKey(file.idempotencyKey())
                .build();
    }

    private static MatchedPatient toMatchedPatient(MatchResult match) {
        return new MatchedPatient(match.patientId(), match.candidate().displayName(),
                match.candidate().nationalId(), match.score());
    }

    private StoredDocument toStored(ExtractedDocument document) {
        DocumentClassification classification = document.getClassification() == null
                ? DocumentClassification.unclassified()
                : document.getClassification();
        MatchedPatient patient = document.getMatchedPatient();
        String suggestedName = patient == null ? null : DocumentNames.suggestedName(
                patient.name(),
                classification.type().getLabel(),
                document.getFileName(),
                LocalDate.ofInstant(document.getCreatedAt(), ZoneOffset.UTC));

        return StoredDocument.builder()
                .id(document.getId())
                .fileName(document.getFileName())
                .suggestedName(suggestedName)
                .contentType(document.getContentType())
                .patientId(patient == null ? null : patient.id())
                .patientName(patient == null ? null : patient.name())
                .documentType(classification.type())
                .documentTypeConfidence(classification.confidence())
                .status(document.getStatus())
                .reviewReason(document.getReviewReason())
                .errorMessage(document.getErrorMessage())
                .ocrText(document.getExtractedText())
                .ocrConfidence(document.getOcrConfidence())
                .matchConfidence(patient == null ? 0.0 : patient.matchConfidence())
                .sizeBytes(document.getSizeBytes())
                .uploadedAt(document.getCreatedAt())
                .source(SOURCE)
                .idempotencyKey(document.getIdempotencyKey())
                .build();
    }

    private record FileOutcome(ExtractedDocument document, boolean duplicate, boolean skipped) {

        static FileOutcome processed(ExtractedDocument document) {
            return new FileOutcome(document, false, false);
        }

        static FileOutcome duplicate(ExtractedDocument document) {
            return new FileOutcome(document, true, false);
        }

        static FileOutcome skipped(ExtractedDocument document) {
            return new FileOutcome(document, false, true);
        }
    }
}
