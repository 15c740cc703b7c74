package com.example.intake.storage;

import com.example.intake.matching.ReviewReason;
import com.example.intake.pipeline.DocumentStatus;
import com.example.intake.util.StorageTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static com.example.intake.util.StoredDocumentTestBuilder.aPatientDocument;
import static com.example.intake.util.StoredDocumentTestBuilder.aStoredDocument;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentRepository")
class DocumentRepositoryTest {

    private StorageTestSupport support;
    private DocumentRepository repository;

    @BeforeEach
    void setUp() {
        support = new StorageTestSupport();
        support.properties().getStorage().setOcrTextMaxLength(20);
        repository = new DocumentRepository(support.storageManager(), support.properties());
    }

    @Nested
    @DisplayName("saveDocument")
    class SaveDocument {

        @Test
        @DisplayName("should store unmatched documents in the triage list")
        void shouldStoreUnmatchedInTriage() {
            StepVerifier.create(repository.saveDocument(aStoredDocument().withId("d1").build())
                            .then(repository.findTriageDocuments()))
                    .assertNext(documents -> assertThat(documents).extracting(StoredDocument::getId).containsExactly("d1"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should store matched documents in the patient list")
        void shouldStoreMatchedInPatientList() {
            StepVerifier.create(repository.saveDocument(aPatientDocument("p1").withId("d1").build())
                            .then(repository.findPatientDocuments("p1")))
                    .assertNext(documents -> assertThat(documents).extracting(StoredDocument::getId).containsExactly("d1"))
                    .verifyComplete();

            StepVerifier.create(repository.findTriageDocuments())
                    .assertNext(documents -> assertThat(documents).isEmpty())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should replace a document with the same id")
        void shouldReplaceDocumentWithSameId() {
            StoredDocument first = aStoredDocument().withId("d1").withFileName("first.pdf").build();
            StoredDocument second = aStoredDocument().withId("d1").withFileName("second.pdf").build();

            StepVerifier.create(repository.saveDocument(first)
                            .then(repository.saveDocument(second))
                            .then(repository.findTriageDocuments()))
                    .assertNext(documents -> assertThat(documents).extracting(StoredDocument::getFileName)
                            .containsExactly("second.pdf"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should truncate OCR text")
        void shouldTruncateOcrText() {
            StoredDocument document = aStoredDocument().withOcrText("x".repeat(50)).build();

            StepVerifier.create(repository.saveDocument(document))
                    .assertNext(saved -> assertThat(saved.getOcrText()).hasSize(20))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("assignToPatient")
    class AssignToPatient {

        @Test
        @DisplayName("should move a triage document to the patient list as manually matched")
        void shouldMoveTriageDocumentToPatient() {
            StoredDocument pending = aStoredDocument().withId("d1").build().toBuilder()
                    .reviewReason(ReviewReason.BELOW_THRESHOLD)
                    .build();

            StepVerifier.create(repository.saveDocument(pending)
                            .then(repository.assignToPatient("d1", "p7", "Ayşe Kaya")))
                    .assertNext(assigned -> {
                        assertThat(assigned.getPatientId()).isEqualTo("p7");
                        assertThat(assigned.getPatientName()).isEqualTo("Ayşe Kaya");
                        assertThat(assigned.getStatus()).isEqualTo(DocumentStatus.MANUAL_MATCHED);
                        assertThat(assigned.getReviewReason()).isNull();
                        assertThat(assigned.getMatchConfidence()).isEqualTo(1.0);
                    })
                    .verifyComplete();

            StepVerifier.create(repository.findTriageDocuments())
                    .assertNext(documents -> assertThat(documents).isEmpty())
                    .verifyComplete();
            StepVerifier.create(repository.findPatientDocuments("p7"))
                    .assertNext(documents -> assertThat(documents).extracting(StoredDocument::getId).containsExactly("d1"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty for an unknown document")
        void shouldCompleteEmptyForUnknownDocument() {
            StepVerifier.create(repository.assignToPatient("missing", "p7", null))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("findById and deleteDocument")
    class FindAndDelete {

        @Test
        @DisplayName("should locate a document in any list")
        void shouldLocateDocumentInAnyList() {
            StepVerifier.create(repository.saveDocument(aPatientDocument("p1").withId("d1").build())
                            .then(repository.findById("d1")))
                    .assertNext(located -> assertThat(located.key())
                            .isEqualTo(support.storageManager().patientKey("p1")))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should delete an existing document and report a missing one")
        void shouldDeleteDocument() {
            StepVerifier.create(repository.saveDocument(aStoredDocument().withId("d1").build())
                            .then(repository.deleteDocument("d1")))
                    .expectNext(true)
                    .verifyComplete();

            StepVerifier.create(repository.deleteDocument("d1"))
                    .expectNext(false)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("idempotency keys")
    class IdempotencyKeys {

        @Test
        @DisplayName("should resolve a remembered token to its document")
        void shouldResolveRememberedToken() {
            StepVerifier.create(repository.saveDocument(aStoredDocument().withId("d1").build())
                            .then(repository.rememberIdempotencyKey("batch-1:0", "d1"))
                            .then(repository.findByIdempotencyKey("batch-1:0")))
                    .assertNext(document -> assertThat(document.getId()).isEqualTo("d1"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty for an unknown token")
        void shouldCompleteEmptyForUnknownToken() {
            StepVerifier.create(repository.findByIdempotencyKey("unknown"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty when the remembered document was deleted")
        void shouldCompleteEmptyWhenDocumentDeleted() {
            StepVerifier.create(repository.saveDocument(aStoredDocument().withId("d1").build())
                            .then(repository.rememberIdempotencyKey("batch-1:0", "d1"))
                            .then(repository.deleteDocument("d1"))
                            .then(repository.findByIdempotencyKey("batch-1:0")))
                    .verifyComplete();
        }
    }
}
