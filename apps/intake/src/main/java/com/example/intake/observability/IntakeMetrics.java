package com.example.intake.observability;

import com.example.intake.pipeline.DocumentStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Centralized service for recording intake metrics.
 * Uses bounded tag values to prevent high-cardinality metric explosion.
 */
@Component
public class IntakeMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";
    private static final String TAG_UNKNOWN = "unknown";
    private static final int MAX_TAG_LENGTH = 50;

    private final MeterRegistry registry;

    private final Counter batchCompleted;
    private final Counter batchCancelled;
    private final Counter duplicateSkipped;
    private final Counter extractionFailure;
    private final DistributionSummary documentSize;
    private final DistributionSummary artifactSize;

    private final Counter cleanupRuns;
    private final DistributionSummary cleanupFreedBytes;
    private final Counter quotaRemediated;
    private final Counter quotaExceeded;

    private final Counter migrationMigrated;
    private final Counter migrationSkipped;

    public IntakeMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.batchCompleted = Counter.builder("intake.batch")
                .tag("outcome", "completed")
                .description("Batches processed to the end")
                .register(registry);

        this.batchCancelled = Counter.builder("intake.batch")
                .tag("outcome", "cancelled")
                .description("Batches stopped by cancellation")
                .register(registry);

        this.duplicateSkipped = Counter.builder("intake.document.duplicate")
                .description("Files skipped because their idempotency key was already persisted")
                .register(registry);

        this.extractionFailure = Counter.builder("intake.extraction")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Files whose text extraction failed")
                .register(registry);

        this.documentSize = DistributionSummary.builder("intake.document.size.bytes")
                .description("Size of ingested files in bytes")
                .baseUnit("bytes")
                .publishPercentiles(0.5, 0.95)
                .register(registry);

        this.artifactSize = DistributionSummary.builder("intake.artifact.size.bytes")
                .description("Size of compressed artifacts in bytes")
                .baseUnit("bytes")
                .register(registry);

        this.cleanupRuns = Counter.builder("intake.storage.cleanup")
                .description("Storage cleanup passes")
                .register(registry);

        this.cleanupFreedBytes = DistributionSummary.builder("intake.storage.cleanup.freed.bytes")
                .description("Bytes freed per cleanup pass")
                .baseUnit("bytes")
                .register(registry);

        this.quotaRemediated = Counter.builder("intake.storage.quota")
                .tag("result", "remediated")
                .description("Writes that succeeded after cleanup")
                .register(registry);

        this.quotaExceeded = Counter.builder("intake.storage.quota")
                .tag("result", "exceeded")
                .description("Writes rejected even after cleanup")
                .register(registry);

        this.migrationMigrated = Counter.builder("intake.migration.records")
                .tag("result", "migrated")
                .description("Legacy records migrated")
                .register(registry);

        this.migrationSkipped = Counter.builder("intake.migration.records")
                .tag("result", "skipped")
                .description("Legacy records skipped as duplicates")
                .register(registry);
    }

    public void recordDocumentProcessed(@Nullable DocumentStatus status, long sizeBytes) {
        registry.counter("intake.document.processed",
                Tags.of("status", status == null ? TAG_UNKNOWN : status.getCode()))
                .increment();
        documentSize.record(sizeBytes);
    }

    public void recordArtifact(long sizeBytes) {
        artifactSize.record(sizeBytes);
    }

    public void recordDuplicateSkipped() {
        duplicateSkipped.increment();
    }

    public void recordExtractionFailure() {
        extractionFailure.increment();
    }

    public void recordBatch(boolean cancelled) {
        if (cancelled) {
            batchCancelled.increment();
        } else {
            batchCompleted.increment();
        }
    }

    public void recordRegistryLookup(@Nullable String source, boolean success) {
        registry.counter("intake.registry.lookup",
                Tags.of("source", sanitizeTag(source), "outcome", success ? OUTCOME_SUCCESS : OUTCOME_FAILURE))
                .increment();
    }

    public void recordCleanup(long freedBytes) {
        cleanupRuns.increment();
        cleanupFreedBytes.record(freedBytes);
    }

    public void recordQuotaRemediation(boolean succeeded) {
        if (succeeded) {
            quotaRemediated.increment();
        } else {
            quotaExceeded.increment();
        }
    }

    public void recordMigration(int migrated, int skipped) {
        migrationMigrated.increment(migrated);
        migrationSkipped.increment(skipped);
    }

    @NonNull
    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
        return sanitized.length() > MAX_TAG_LENGTH ? sanitized.substring(0, MAX_TAG_LENGTH) : sanitized;
    }
}
