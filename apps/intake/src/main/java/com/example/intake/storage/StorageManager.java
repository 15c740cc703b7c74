package com.example.intake.storage;

import com.example.intake.config.IntakeProperties;
import com.example.intake.exception.QuotaExceededException;
import com.example.intake.exception.StoreCapacityException;
import com.example.intake.observability.IntakeMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Owns the managed key space ({@code intake:} by default) of the key-value store and keeps it
 * within the configured byte budget.
 * <p>
 * Key layout:
 * <ul>
 *   <li>{@code intake:documents} triage list of documents not reconciled to a patient</li>
 *   <li>{@code intake:patient:<id>:documents} documents of one patient</li>
 *   <li>{@code intake:idempotency:<token>} idempotency token record</li>
 *   <li>{@code intake:migrated:<legacyKey>} time at which a legacy key was migrated</li>
 *   <li>{@code intake:temp:<epochMillis>:<name>} and {@code intake:cache:<epochMillis>:<name>}
 *       transient keys, removed by cleanup once older than the configured max age</li>
 * </ul>
 * Writes go through {@link #put}: on a projected or actual overflow, {@link #cleanup()} runs once
 * and the write is retried once; a second failure is a {@link QuotaExceededException}.
 * <p>
 * Document lists are read-modify-written without locking; callers are expected to serialize
 * writes to the same list (the ingestion pipeline processes one file at a time).
 */
@Slf4j
@Component
public class StorageManager {

    private static final TypeReference<List<StoredDocument>> DOCUMENT_LIST = new TypeReference<>() {};
    private static final String TRIAGE_SUFFIX = "documents";
    private static final String PATIENT_SEGMENT = "patient:";
    private static final String DOCUMENTS_SEGMENT = ":documents";
    private static final String IDEMPOTENCY_SEGMENT = "idempotency:";
    private static final String TEMP_SEGMENT = "temp:";
    private static final String CACHE_SEGMENT = "cache:";
    private static final String MIGRATED_SEGMENT = "migrated:";

    static final Comparator<StoredDocument> MOST_RECENT_FIRST = Comparator.comparing(
            StoredDocument::getUploadedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final KeyValueStore store;
    private final IntakeProperties.Storage settings;
    private final ObjectMapper objectMapper;
    private final LegacyDocumentMapper legacyMapper;
    private final IntakeMetrics metrics;
    private final Clock clock;
    private final String prefix;

    public StorageManager(
            KeyValueStore store,
            IntakeProperties properties,
            ObjectMapper objectMapper,
            LegacyDocumentMapper legacyMapper,
            IntakeMetrics metrics,
            Clock clock) {
        this.store = store;
        this.settings = properties.getStorage();
        this.objectMapper = objectMapper;
        this.legacyMapper = legacyMapper;
        this.metrics = metrics;
        this.clock = clock;
        this.prefix = settings.getKeyPrefix();
    }

    // ---- key layout ----

    public String triageKey() {
        return prefix + TRIAGE_SUFFIX;
    }

    public String patientKey(String patientId) {
        return prefix + PATIENT_SEGMENT + patientId + DOCUMENTS_SEGMENT;
    }

    public String idempotencyKey(String token) {
        return prefix + IDEMPOTENCY_SEGMENT + token;
    }

    public String tempKey(String name) {
        return prefix + TEMP_SEGMENT + clock.millis() + ":" + name;
    }

    public String migrationMarkerKey(String legacyKey) {
        return prefix + MIGRATED_SEGMENT + legacyKey;
    }

    public boolean isPatientKey(String key) {
        return key.startsWith(prefix + PATIENT_SEGMENT) && key.endsWith(DOCUMENTS_SEGMENT);
    }

    // ---- quota ----

    @NonNull
    public Mono<StorageQuota> checkQuota() {
        return usedBytes().map(used -> {
            long limit = settings.getLimitBytes();
            int percentage = limit > 0 ? (int) Math.round(used * 100.0 / limit) : 100;
            boolean canWrite = used < limit * settings.getWriteHeadroomRatio();
            return new StorageQuota(used, limit, percentage, canWrite);
        });
    }

    // ---- raw access ----

    public Mono<String> get(String key) {
        return store.get(key);
    }

    public Mono<Boolean> remove(String key) {
        return store.remove(key);
    }

    public Flux<String> keys(String relativePrefix) {
        return store.keys(prefix + relativePrefix);
    }

    /**
     * Writes {@code value} under {@code key}, running cleanup and retrying once when the budget
     * or the medium refuses the write.
     */
    @NonNull
    public Mono<Void> put(String key, String value) {
        return writeWithRemediation(key, Mono.fromSupplier(() -> value));
    }

    /**
     * Same as {@link #put}, with the value recomputed for the retry. Document list writes use this
     * so the retry re-reads the list that cleanup may have just rewritten.
     */
    Mono<Void> writeWithRemediation(String key, Mono<String> value) {
        return attemptWrite(key, value)
                .onErrorResume(StoreCapacityException.class, first -> {
                    log.warn("Write to {} rejected ({}), running cleanup and retrying once", key, first.getMessage());
                    return cleanup()
                            .then(Mono.defer(() -> attemptWrite(key, value)))
                            .doOnSuccess(ignored -> {
                                metrics.recordQuotaRemediation(true);
                                log.info("Stored {} after cleanup", key);
                            })
                            .onErrorResume(StoreCapacityException.class, second -> {
                                metrics.recordQuotaRemediation(false);
                                log.error("Storage quota exceeded even after cleanup for {}: {}", key, second.getMessage());
                                return checkQuota().flatMap(quota -> Mono.<Void>error(
                                        new QuotaExceededException(key, quota.usedBytes(), quota.limitBytes())));
                            });
                });
    }

    private Mono<Void> attemptWrite(String key, Mono<String> value) {
        return Mono.zip(value, usedBytes(), currentSize(key))
                .flatMap(state -> {
                    String newValue = state.getT1();
                    long projected = state.getT2() - state.getT3() + sizeOf(key, newValue);
                    if (projected > settings.getLimitBytes()) {
                        return Mono.<Void>error(new StoreCapacityException(key,
                                "Projected usage " + projected + " exceeds limit " + settings.getLimitBytes()));
                    }
                    return store.set(key, newValue);
                });
    }

    // ---- document lists ----

    /**
     * Every document-list key: the triage list and each patient list.
     */
    public Flux<String> documentListKeys() {
        return Flux.concat(
                Flux.just(triageKey()),
                store.keys(prefix + PATIENT_SEGMENT).filter(this::isPatientKey));
    }

    public Mono<List<StoredDocument>> readDocuments(String key) {
        return store.get(key)
                .flatMap(json -> {
                    try {
                        List<StoredDocument> documents = objectMapper.readValue(json, DOCUMENT_LIST);
                        return Mono.just(documents == null ? List.<StoredDocument>of() : documents);
                    } catch (JsonProcessingException e) {
                        log.error("Document list under {} is not valid JSON: {}", key, e.getOriginalMessage());
                        return Mono.<List<StoredDocument>>error(e);
                    }
                })
                .defaultIfEmpty(List.of());
    }

    /**
     * Reads the list under {@code key}, applies {@code mutation} to a mutable copy and writes the
     * result back through the remediation path. On a retry after cleanup the mutation is applied
     * again to the freshly read list.
     *
     * @return the list as written
     */
    public Mono<List<StoredDocument>> updateDocuments(String key, UnaryOperator<List<StoredDocument>> mutation) {
        AtomicReference<List<StoredDocument>> written = new AtomicReference<>(List.of());
        Mono<String> json = readDocuments(key)
                .map(current -> mutation.apply(new ArrayList<>(current)))
                .doOnNext(written::set)
                .flatMap(this::toJson);
        return writeWithRemediation(key, json).then(Mono.fromSupplier(written::get));
    }

    // ---- cleanup ----

    /**
     * (a) trims the triage list to the retention count, (b) strips binary payloads from every
     * document outside the retention count most recent ones, (c) removes expired transient keys.
     * Metadata of documents kept by (a) is never touched.
     */
    @NonNull
    public Mono<CleanupReport> cleanup() {
        return usedBytes().flatMap(before ->
                trimTriage()
                        .flatMap(trimmed -> stripOldPayloads()
                                .flatMap(stripped -> removeExpiredTransientKeys()
                                        .flatMap(removed -> usedBytes()
                                                .map(after -> new CleanupReport(trimmed, stripped, removed, before, after))))))
                .doOnNext(report -> {
                    metrics.recordCleanup(report.freedBytes());
                    log.info("Storage cleanup: trimmed={}, strippedPayloads={}, removedTransientKeys={}, freed={} bytes",
                            report.trimmedDocuments(), report.strippedPayloads(),
                            report.removedTransientKeys(), report.freedBytes());
                });
    }

    private Mono<Integer> trimTriage() {
        int retention = settings.getRetentionCount();
        return readDocuments(triageKey()).flatMap(documents -> {
            if (documents.size() <= retention) {
                return Mono.just(0);
            }
            List<StoredDocument> kept = new ArrayList<>(documents);
            kept.sort(MOST_RECENT_FIRST);
            kept = kept.subList(0, retention);
            int trimmed = documents.size() - kept.size();
            return writeDirect(triageKey(), kept).thenReturn(trimmed);
        });
    }

    private Mono<Integer> stripOldPayloads() {
        int retention = settings.getRetentionCount();
        return documentListKeys()
                .concatMap(key -> readDocuments(key).map(documents -> Map.entry(key, documents)))
                .collectList()
                .flatMap(lists -> {
                    List<StoredDocument> all = new ArrayList<>();
                    lists.forEach(entry -> all.addAll(entry.getValue()));
                    all.sort(MOST_RECENT_FIRST);
                    Set<String> keepPayload = new HashSet<>();
                    for (int i = 0; i < Math.min(retention, all.size()); i++) {
                        keepPayload.add(all.get(i).getId());
                    }

                    Instant now = clock.instant();
                    int[] stripped = {0};
                    List<Mono<Void>> writes = new ArrayList<>();
                    for (Map.Entry<String, List<StoredDocument>> entry : lists) {
                        boolean changed = false;
                        List<StoredDocument> rewritten = new ArrayList<>(entry.getValue().size());
                        for (StoredDocument document : entry.getValue()) {
                            if (document.hasPayload() && !keepPayload.contains(document.getId())) {
                                rewritten.add(document.withoutPayload(now));
                                stripped[0]++;
                                changed = true;
                            } else {
                                rewritten.add(document);
                            }
                        }
                        if (changed) {
                            writes.add(writeDirect(entry.getKey(), rewritten));
                        }
                    }
                    return Flux.concat(writes).then(Mono.fromSupplier(() -> stripped[0]));
                });
    }

    private Mono<Integer> removeExpiredTransientKeys() {
        long cutoff = clock.millis() - settings.getTransientMaxAge().toMillis();
        return Flux.concat(store.keys(prefix + TEMP_SEGMENT), store.keys(prefix + CACHE_SEGMENT))
                .filter(key -> {
                    Long timestamp = transientTimestamp(key);
                    return timestamp != null && timestamp < cutoff;
                })
                .concatMap(key -> store.remove(key)
                        .doOnNext(removed -> log.debug("Removed expired transient key {}", key)))
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue);
    }

    private Long transientTimestamp(String key) {
        String rest = key.substring(prefix.length());
        int start = rest.indexOf(':') + 1;
        int end = rest.indexOf(':', start);
        String millis = end < 0 ? rest.substring(start) : rest.substring(start, end);
        try {
            return Long.parseLong(millis);
        } catch (NumberFormatException e) {
            log.debug("Transient key without timestamp, leaving it: {}", key);
            return null;
        }
    }

    // ---- legacy migration ----

    /**
     * Copies documents from the configured legacy keys into the canonical layout. A record whose id
     * already exists is skipped, never merged. Each legacy key that was read successfully gets a
     * marker once its records are written, and marked keys are not read again, so documents deleted
     * or trimmed after the migration stay gone. Legacy keys themselves are left in place.
     *
     * @return number of records newly migrated
     */
    @NonNull
    public Mono<Integer> migrateLegacyKeys() {
        return existingDocumentIds().flatMap(existingIds ->
                Flux.fromIterable(settings.getLegacyKeys())
                        .filterWhen(this::notYetMigrated)
                        .concatMap(definition -> readLegacyKey(definition)
                                .map(records -> Map.entry(definition.key(), records)))
                        .collectList()
                        .flatMap(sources -> {
                            Map<String, List<StoredDocument>> byTarget = new LinkedHashMap<>();
                            int read = 0;
                            int skipped = 0;
                            for (Map.Entry<String, List<StoredDocument>> source : sources) {
                                for (StoredDocument record : source.getValue()) {
                                    read++;
                                    if (!existingIds.add(record.getId())) {
                                        skipped++;
                                        continue;
                                    }
                                    String target = record.getPatientId() == null
                                            ? triageKey() : patientKey(record.getPatientId());
                                    byTarget.computeIfAbsent(target, k -> new ArrayList<>()).add(record);
                                }
                            }
                            int migrated = read - skipped;
                            int duplicates = skipped;
                            return Flux.fromIterable(byTarget.entrySet())
                                    .concatMap(entry -> updateDocuments(entry.getKey(), current -> {
                                        current.addAll(entry.getValue());
                                        return current;
                                    }))
                                    .thenMany(Flux.fromIterable(sources))
                                    .concatMap(source -> markMigrated(source.getKey()))
                                    .then(Mono.fromSupplier(() -> {
                                        metrics.recordMigration(migrated, duplicates);
                                        log.info("Legacy migration: migrated={}, skippedDuplicates={}", migrated, duplicates);
                                        return migrated;
                                    }));
                        }));
    }

    private Mono<Boolean> notYetMigrated(LegacyKeyDefinition definition) {
        return store.get(migrationMarkerKey(definition.key()))
                .map(migratedAt -> {
                    log.debug("Legacy key {} already migrated at {}", definition.key(), migratedAt);
                    return false;
                })
                .defaultIfEmpty(true);
    }

    private Mono<Void> markMigrated(String legacyKey) {
        return put(migrationMarkerKey(legacyKey), clock.instant().toString())
                .doOnSuccess(ignored -> log.debug("Marked legacy key {} as migrated", legacyKey));
    }

    /**
     * Records of one legacy key; empty when the key is absent or malformed.
     */
    private Mono<List<StoredDocument>> readLegacyKey(LegacyKeyDefinition definition) {
        return store.get(definition.key())
                .flatMap(raw -> {
                    try {
                        JsonNode root = objectMapper.readTree(raw);
                        return Mono.just(legacyMapper.map(definition, root));
                    } catch (JsonProcessingException | IllegalArgumentException e) {
                        log.warn("Skipping malformed legacy key {}: {}", definition.key(), e.getMessage());
                        return Mono.empty();
                    }
                });
    }

    private Mono<Set<String>> existingDocumentIds() {
        return documentListKeys()
                .concatMap(this::readDocuments)
                .flatMapIterable(documents -> documents)
                .map(StoredDocument::getId)
                .<Set<String>>collect(HashSet::new, Set::add);
    }

    // ---- helpers ----

    private Mono<Void> writeDirect(String key, List<StoredDocument> documents) {
        return toJson(documents).flatMap(json -> store.set(key, json));
    }

    private Mono<String> toJson(List<StoredDocument> documents) {
        try {
            return Mono.just(objectMapper.writeValueAsString(documents));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize document list: {}", e.getMessage());
            return Mono.error(e);
        }
    }

    private Mono<Long> usedBytes() {
        return store.keys(prefix)
                .concatMap(key -> store.get(key).map(value -> sizeOf(key, value)))
                .reduce(0L, Long::sum);
    }

    private Mono<Long> currentSize(String key) {
        return store.get(key)
                .map(value -> sizeOf(key, value))
                .defaultIfEmpty(0L);
    }

    static long sizeOf(String key, String value) {
        return key.getBytes(StandardCharsets.UTF_8).length + value.getBytes(StandardCharsets.UTF_8).length;
    }
}
