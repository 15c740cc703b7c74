package com.example.intake.storage;

import com.example.intake.common.util.StringSanitizer;
import com.example.intake.config.IntakeProperties;
import com.example.intake.pipeline.DocumentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Document-level operations over the storage manager's document lists.
 * A document lives in exactly one list: its patient's list once matched, the triage list otherwise.
 */
@Slf4j
@Component
public class DocumentRepository {

    private final StorageManager storageManager;
    private final int ocrTextMaxLength;

    public DocumentRepository(StorageManager storageManager, IntakeProperties properties) {
        this.storageManager = storageManager;
        this.ocrTextMaxLength = properties.getStorage().getOcrTextMaxLength();
    }

    /**
     * Inserts or replaces (by id) the document in the list it belongs to.
     */
    @NonNull
    public Mono<StoredDocument> saveDocument(@NonNull StoredDocument document) {
        StoredDocument toSave = truncateOcrText(document);
        String key = listKeyFor(toSave);
        return storageManager.updateDocuments(key, documents -> upsert(documents, toSave))
                .doOnNext(documents -> log.debug("Saved document {} to {} ({} documents)",
                        toSave.getId(), key, documents.size()))
                .thenReturn(toSave);
    }

    @NonNull
    public Mono<List<StoredDocument>> findPatientDocuments(@NonNull String patientId) {
        return storageManager.readDocuments(storageManager.patientKey(patientId));
    }

    @NonNull
    public Mono<List<StoredDocument>> findTriageDocuments() {
        return storageManager.readDocuments(storageManager.triageKey());
    }

    @NonNull
    public Mono<LocatedDocument> findById(@NonNull String documentId) {
        return storageManager.documentListKeys()
                .concatMap(key -> storageManager.readDocuments(key)
                        .flatMapIterable(documents -> documents)
                        .filter(document -> documentId.equals(document.getId()))
                        .map(document -> new LocatedDocument(key, document)))
                .next();
    }

    /**
     * @return true when a document was removed
     */
    @NonNull
    public Mono<Boolean> deleteDocument(@NonNull String documentId) {
        return findById(documentId)
                .flatMap(located -> storageManager.updateDocuments(located.key(), documents -> {
                            documents.removeIf(document -> documentId.equals(document.getId()));
                            return documents;
                        })
                        .doOnNext(documents -> log.info("Deleted document {} from {}", documentId, located.key()))
                        .thenReturn(true))
                .defaultIfEmpty(false);
    }

    /**
     * Moves a document to the given patient's list as manually matched.
     */
    @NonNull
    public Mono<StoredDocument> assignToPatient(@NonNull String documentId,
                                                @NonNull String patientId,
                                                String patientName) {
        return findById(documentId)
                .flatMap(located -> {
                    StoredDocument assigned = located.document().toBuilder()
                            .patientId(patientId)
                            .patientName(patientName)
                            .status(DocumentStatus.MANUAL_MATCHED)
                            .matchConfidence(1.0)
                            .reviewReason(null)
                            .build();
                    String target = storageManager.patientKey(patientId);
                    if (located.key().equals(target)) {
                        return saveDocument(assigned);
                    }
                    // write the new location first so a failure never loses the document
                    return saveDocument(assigned)
                            .flatMap(saved -> storageManager.updateDocuments(located.key(), documents -> {
                                documents.removeIf(document -> documentId.equals(document.getId()));
                                return documents;
                            }).thenReturn(saved));
                })
                .doOnNext(saved -> log.info("Assigned document {} to patient {}",
                        documentId, StringSanitizer.forLog(patientId)));
    }

    /**
     * Resolves a token through its token record, falling back to the {@code idempotencyKey} field of
     * the stored documents when the record was never written. Error documents never resolve a token.
     */
    @NonNull
    public Mono<StoredDocument> findByIdempotencyKey(@NonNull String token) {
        return storageManager.get(storageManager.idempotencyKey(token))
                .flatMap(this::findById)
                .map(LocatedDocument::document)
                .switchIfEmpty(Mono.defer(() -> findStoredWithToken(token)));
    }

    private Mono<StoredDocument> findStoredWithToken(String token) {
        return storageManager.documentListKeys()
                .concatMap(storageManager::readDocuments)
                .flatMapIterable(documents -> documents)
                .filter(document -> token.equals(document.getIdempotencyKey())
                        && document.getStatus() != DocumentStatus.ERROR)
                .next()
                .doOnNext(document -> log.debug("Resolved idempotency token from document {}", document.getId()));
    }

    @NonNull
    public Mono<Void> rememberIdempotencyKey(@NonNull String token, @NonNull String documentId) {
        return storageManager.put(storageManager.idempotencyKey(token), documentId);
    }

    private String listKeyFor(StoredDocument document) {
        return document.getPatientId() == null
                ? storageManager.triageKey()
                : storageManager.patientKey(document.getPatientId());
    }

    private StoredDocument truncateOcrText(StoredDocument document) {
        String text = document.getOcrText();
        if (text == null || text.length() <= ocrTextMaxLength) {
            return document;
        }
        return document.toBuilder().ocrText(text.substring(0, ocrTextMaxLength)).build();
    }

    private static List<StoredDocument> upsert(List<StoredDocument> documents, StoredDocument document) {
        for (int i = 0; i < documents.size(); i++) {
            if (Objects.equals(documents.get(i).getId(), document.getId())) {
                documents.set(i, document);
                return documents;
            }
        }
        documents.add(document);
        return documents;
    }

    /**
     * A stored document together with the list key it was found under.
     */
    public record LocatedDocument(String key, StoredDocument document) {}
}
