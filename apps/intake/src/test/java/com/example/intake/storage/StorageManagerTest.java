package com.example.intake.storage;

import com.example.intake.exception.QuotaExceededException;
import com.example.intake.util.StorageTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.example.intake.util.StoredDocumentTestBuilder.aPatientDocument;
import static com.example.intake.util.StoredDocumentTestBuilder.aStoredDocument;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StorageManager")
class StorageManagerTest {

    private static final Instant BASE = Instant.parse("2024-03-01T00:00:00Z");

    private StorageTestSupport support;
    private StorageManager storageManager;

    @BeforeEach
    void setUp() {
        support = new StorageTestSupport();
        storageManager = support.storageManager();
        support.properties().getStorage().setRetentionCount(2);
    }

    private void seed(String key, List<StoredDocument> documents) throws Exception {
        support.store().set(key, support.objectMapper().writeValueAsString(documents)).block();
    }

    private List<StoredDocument> read(String key) {
        return storageManager.readDocuments(key).block();
    }

    @Nested
    @DisplayName("key layout")
    class KeyLayout {

        @Test
        @DisplayName("should place lists under the managed prefix")
        void shouldPlaceListsUnderManagedPrefix() {
            assertThat(storageManager.triageKey()).isEqualTo("intake:documents");
            assertThat(storageManager.patientKey("p1")).isEqualTo("intake:patient:p1:documents");
            assertThat(storageManager.idempotencyKey("k")).isEqualTo("intake:idempotency:k");
            assertThat(storageManager.tempKey("batch-1"))
                    .isEqualTo("intake:temp:" + StorageTestSupport.NOW.toEpochMilli() + ":batch-1");
            assertThat(storageManager.migrationMarkerKey("sgk_documents")).isEqualTo("intake:migrated:sgk_documents");
            assertThat(storageManager.isPatientKey("intake:patient:p1:documents")).isTrue();
            assertThat(storageManager.isPatientKey("intake:documents")).isFalse();
        }
    }

    @Nested
    @DisplayName("checkQuota")
    class CheckQuota {

        @Test
        @DisplayName("should count managed keys and values only")
        void shouldCountManagedKeysAndValuesOnly() {
            support.properties().getStorage().setLimitBytes(1000);
            support.store().set("unmanaged", "x".repeat(500)).block();

            StepVerifier.create(storageManager.put("intake:a", "12345").then(storageManager.checkQuota()))
                    .assertNext(quota -> {
                        assertThat(quota.usedBytes()).isEqualTo(13);
                        assertThat(quota.limitBytes()).isEqualTo(1000);
                        assertThat(quota.percentage()).isEqualTo(1);
                        assertThat(quota.canWrite()).isTrue();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse further writes past the headroom ratio")
        void shouldRefuseWritesPastHeadroom() {
            support.properties().getStorage().setLimitBytes(1000);
            support.store().set("intake:big", "x".repeat(892)).block();

            StepVerifier.create(storageManager.checkQuota())
                    .assertNext(quota -> {
                        assertThat(quota.usedBytes()).isEqualTo(902);
                        assertThat(quota.percentage()).isEqualTo(90);
                        assertThat(quota.canWrite()).isFalse();
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("put")
    class Put {

        @Test
        @DisplayName("should run cleanup and retry once when the budget refuses a write")
        void shouldCleanupAndRetry() throws Exception {
            List<StoredDocument> triage = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                triage.add(aStoredDocument()
                        .withId("t" + i)
                        .withUploadedAt(BASE.plusSeconds(i))
                        .withFileData("x".repeat(1000))
                        .build());
            }
            seed(storageManager.triageKey(), triage);
            long used = storageManager.checkQuota().block().usedBytes();
            support.properties().getStorage().setLimitBytes(used + 1500);

            StepVerifier.create(storageManager.put("intake:extra", "y".repeat(2000)))
                    .verifyComplete();

            assertThat(read(storageManager.triageKey())).extracting(StoredDocument::getId)
                    .containsExactly("t4", "t3");
            assertThat(support.counter("intake.storage.quota", "result", "remediated")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fail with QuotaExceededException when cleanup frees too little")
        void shouldFailWhenCleanupFreesTooLittle() {
            support.properties().getStorage().setLimitBytes(100);

            StepVerifier.create(storageManager.put("intake:big", "x".repeat(200)))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(QuotaExceededException.class);
                        assertThat(((QuotaExceededException) error).getKey()).isEqualTo("intake:big");
                        assertThat(((QuotaExceededException) error).getLimitBytes()).isEqualTo(100);
                    })
                    .verify();

            assertThat(support.counter("intake.storage.quota", "result", "exceeded")).isEqualTo(1.0);
            StepVerifier.create(storageManager.get("intake:big")).verifyComplete();
        }
    }

    @Nested
    @DisplayName("updateDocuments")
    class UpdateDocuments {

        @Test
        @DisplayName("should apply the mutation and return the written list")
        void shouldApplyMutation() {
            StoredDocument document = aStoredDocument().withId("d1").build();

            StepVerifier.create(storageManager.updateDocuments(storageManager.triageKey(), documents -> {
                        documents.add(document);
                        return documents;
                    }))
                    .assertNext(written -> assertThat(written).extracting(StoredDocument::getId).containsExactly("d1"))
                    .verifyComplete();

            assertThat(read(storageManager.triageKey())).extracting(StoredDocument::getId).containsExactly("d1");
        }

        @Test
        @DisplayName("should fail on a list that is not valid JSON")
        void shouldFailOnInvalidJson() {
            support.store().set(storageManager.triageKey(), "{not json").block();

            StepVerifier.create(storageManager.readDocuments(storageManager.triageKey()))
                    .expectError()
                    .verify();
        }
    }

    @Nested
    @DisplayName("cleanup")
    class Cleanup {

        @Test
        @DisplayName("should trim triage and strip payloads outside the most recent documents")
        void shouldTrimTriageAndStripOldPayloads() throws Exception {
            seed(storageManager.triageKey(), List.of(
                    aStoredDocument().withId("t1").withUploadedAt(BASE.plusSeconds(1)).withPayload("cGRm").build(),
                    aStoredDocument().withId("t2").withUploadedAt(BASE.plusSeconds(2)).withPayload("cGRm").build(),
                    aStoredDocument().withId("t3").withUploadedAt(BASE.plusSeconds(3)).withPayload("cGRm").build()));
            seed(storageManager.patientKey("p1"), List.of(
                    aPatientDocument("p1").withId("pa").withUploadedAt(BASE.plusSeconds(4)).withPayload("cGRm").build(),
                    aPatientDocument("p1").withId("pb").withUploadedAt(BASE.plusSeconds(5)).withPayload("cGRm").build(),
                    aPatientDocument("p1").withId("pc").withUploadedAt(BASE.plusSeconds(6)).withPayload("cGRm").build()));

            StepVerifier.create(storageManager.cleanup())
                    .assertNext(report -> {
                        assertThat(report.trimmedDocuments()).isEqualTo(1);
                        assertThat(report.strippedPayloads()).isEqualTo(3);
                        assertThat(report.removedTransientKeys()).isZero();
                        assertThat(report.freedBytes()).isPositive();
                    })
                    .verifyComplete();

            List<StoredDocument> triage = read(storageManager.triageKey());
            assertThat(triage).extracting(StoredDocument::getId).containsExactly("t3", "t2");
            assertThat(triage).allSatisfy(document -> {
                assertThat(document.hasPayload()).isFalse();
                assertThat(document.getHasPdf()).isTrue();
                assertThat(document.getFileName()).isEqualTo("scan.pdf");
                assertThat(document.getPayloadEvictedAt()).isEqualTo(StorageTestSupport.NOW);
            });

            List<StoredDocument> patient = read(storageManager.patientKey("p1"));
            assertThat(patient).filteredOn(StoredDocument::hasPayload)
                    .extracting(StoredDocument::getId)
                    .containsExactlyInAnyOrder("pb", "pc");
            assertThat(patient).extracting(StoredDocument::getPatientId).containsOnly("p1");
        }

        @Test
        @DisplayName("should leave lists within the retention count untouched")
        void shouldLeaveSmallListsUntouched() throws Exception {
            seed(storageManager.triageKey(), List.of(
                    aStoredDocument().withId("t1").withPayload("cGRm").build()));

            StepVerifier.create(storageManager.cleanup())
                    .assertNext(report -> {
                        assertThat(report.trimmedDocuments()).isZero();
                        assertThat(report.strippedPayloads()).isZero();
                    })
                    .verifyComplete();

            assertThat(read(storageManager.triageKey()).get(0).hasPayload()).isTrue();
        }

        @Test
        @DisplayName("should remove expired transient keys only")
        void shouldRemoveExpiredTransientKeys() {
            long expired = StorageTestSupport.NOW.minus(Duration.ofHours(25)).toEpochMilli();
            support.store().set("intake:temp:" + expired + ":batch-old", "3/5").block();
            support.store().set("intake:cache:" + expired + ":patients", "[]").block();
            support.store().set(storageManager.tempKey("batch-new"), "1/5").block();
            support.store().set("intake:temp:undated", "x").block();

            StepVerifier.create(storageManager.cleanup())
                    .assertNext(report -> assertThat(report.removedTransientKeys()).isEqualTo(2))
                    .verifyComplete();

            StepVerifier.create(storageManager.keys("temp:").collectList())
                    .assertNext(keys -> assertThat(keys).containsExactlyInAnyOrder(
                            storageManager.tempKey("batch-new"), "intake:temp:undated"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("migrateLegacyKeys")
    class MigrateLegacyKeys {

        @BeforeEach
        void seedLegacyKeys() {
            support.store().set("sgk_documents", """
                    [{"id": "l-1", "fileName": "a.pdf", "uploadDate": "2024-01-02T03:04:05Z"},
                     {"id": "l-2", "fileName": "b.pdf", "patientId": "p1"}]
                    """).block();
            support.store().set("xear_sgk_documents", "not json").block();
            support.store().set("xear_patients_documents", """
                    {"p9": [{"id": "l-3", "filename": "c.pdf"}],
                     "p1": [{"id": "l-2", "fileName": "b.pdf"}]}
                    """).block();
        }

        @Test
        @DisplayName("should copy records into the canonical layout, skipping duplicate ids")
        void shouldCopyRecordsIntoCanonicalLayout() {
            StepVerifier.create(storageManager.migrateLegacyKeys())
                    .expectNext(3)
                    .verifyComplete();

            assertThat(read(storageManager.triageKey())).extracting(StoredDocument::getId).containsExactly("l-1");
            assertThat(read(storageManager.patientKey("p1"))).extracting(StoredDocument::getId).containsExactly("l-2");
            assertThat(read(storageManager.patientKey("p9"))).extracting(StoredDocument::getId).containsExactly("l-3");
            StepVerifier.create(support.store().get("sgk_documents").map(String::isEmpty))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should migrate nothing when run a second time")
        void shouldBeIdempotent() {
            StepVerifier.create(storageManager.migrateLegacyKeys().then(storageManager.migrateLegacyKeys()))
                    .expectNext(0)
                    .verifyComplete();

            assertThat(read(storageManager.patientKey("p1"))).hasSize(1);
        }

        @Test
        @DisplayName("should not bring back a migrated document after it is deleted")
        void shouldNotReimportDeletedDocument() {
            DocumentRepository repository = new DocumentRepository(storageManager, support.properties());

            StepVerifier.create(storageManager.migrateLegacyKeys()
                            .then(Mono.defer(() -> repository.deleteDocument("l-1")))
                            .then(Mono.defer(storageManager::migrateLegacyKeys)))
                    .expectNext(0)
                    .verifyComplete();

            assertThat(read(storageManager.triageKey())).isEmpty();
            StepVerifier.create(support.store().get(storageManager.migrationMarkerKey("sgk_documents")))
                    .expectNext(StorageTestSupport.NOW.toString())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should leave malformed legacy keys unmarked")
        void shouldLeaveMalformedKeysUnmarked() {
            StepVerifier.create(storageManager.migrateLegacyKeys()
                            .then(Mono.defer(() -> support.store().get(storageManager.migrationMarkerKey("xear_sgk_documents")))))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should keep documents already stored")
        void shouldKeepExistingDocuments() throws Exception {
            seed(storageManager.triageKey(), List.of(aStoredDocument().withId("l-1").withFileName("current.pdf").build()));

            StepVerifier.create(storageManager.migrateLegacyKeys())
                    .expectNext(2)
                    .verifyComplete();

            assertThat(read(storageManager.triageKey())).extracting(StoredDocument::getFileName)
                    .containsExactly("current.pdf");
        }
    }
}
