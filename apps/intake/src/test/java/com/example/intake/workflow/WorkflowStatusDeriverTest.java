package com.example.intake.workflow;

import com.example.intake.classification.DocumentBundle;
import com.example.intake.classification.DocumentType;
import com.example.intake.pipeline.ExtractedDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.intake.util.ExtractedDocumentTestBuilder.aMatched;
import static com.example.intake.util.ExtractedDocumentTestBuilder.awaitingReview;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WorkflowStatusDeriver")
class WorkflowStatusDeriverTest {

    private final WorkflowStatusDeriver deriver = new WorkflowStatusDeriver();

    @Nested
    @DisplayName("deriveStatus from documents")
    class FromDocuments {

        @Test
        @DisplayName("should be pending without documents")
        void shouldBePendingWithoutDocuments() {
            assertThat(deriver.deriveStatus(List.of())).isEqualTo(WorkflowStatus.BEKLEYEN);
            assertThat(deriver.deriveStatus(null)).isEqualTo(WorkflowStatus.BEKLEYEN);
        }

        @Test
        @DisplayName("should report documents uploaded once the hearing bundle is complete, in any order")
        void shouldCompleteHearingBundleInAnyOrder() {
            List<ExtractedDocument> documents = List.of(
                    aMatched(DocumentType.COMPLIANCE_CERTIFICATE),
                    aMatched(DocumentType.AUDIOGRAM),
                    aMatched(DocumentType.DEVICE_PRESCRIPTION));

            assertThat(deriver.deriveStatus(documents)).isEqualTo(WorkflowStatus.BELGELER_YUKLENDI);
            assertThat(deriver.deriveStatus(List.of(documents.get(2), documents.get(0), documents.get(1))))
                    .isEqualTo(WorkflowStatus.BELGELER_YUKLENDI);
        }

        @Test
        @DisplayName("should complete the battery bundle with a battery prescription alone")
        void shouldCompleteBatteryBundle() {
            WorkflowAssessment assessment = deriver.assess(
                    List.of(aMatched(DocumentType.BATTERY_PRESCRIPTION)), WorkflowSideData.none());

            assertThat(assessment.status()).isEqualTo(WorkflowStatus.BELGELER_YUKLENDI);
            assertThat(assessment.completedBundles()).containsExactly(DocumentBundle.BATTERY);
        }

        @Test
        @DisplayName("should report prescription registered for a device prescription alone")
        void shouldReportPrescriptionRegistered() {
            WorkflowAssessment assessment = deriver.assess(
                    List.of(aMatched(DocumentType.DEVICE_PRESCRIPTION)), WorkflowSideData.none());

            assertThat(assessment.status()).isEqualTo(WorkflowStatus.RECETE_KAYDEDILDI);
            assertThat(assessment.statusLabel()).isEqualTo(WorkflowStatus.RECETE_KAYDEDILDI.getLabel());
            assertThat(assessment.missingDocuments().get(DocumentBundle.HEARING_DEVICE))
                    .containsExactlyInAnyOrder(DocumentType.AUDIOGRAM, DocumentType.COMPLIANCE_CERTIFICATE);
            assertThat(assessment.warnings())
                    .containsExactly("Eksik belgeler (hearing_device): Odyogram, Uygunluk Belgesi");
        }

        @Test
        @DisplayName("should ignore documents awaiting review")
        void shouldIgnoreDocumentsAwaitingReview() {
            List<ExtractedDocument> documents = List.of(
                    awaitingReview(DocumentType.DEVICE_PRESCRIPTION),
                    awaitingReview(DocumentType.AUDIOGRAM),
                    awaitingReview(DocumentType.COMPLIANCE_CERTIFICATE));

            assertThat(deriver.deriveStatus(documents)).isEqualTo(WorkflowStatus.BEKLEYEN);
        }

        @Test
        @DisplayName("should not warn about bundles that were never started")
        void shouldNotWarnAboutUnstartedBundles() {
            WorkflowAssessment assessment = deriver.assess(
                    List.of(aMatched(DocumentType.OTHER)), WorkflowSideData.none());

            assertThat(assessment.warnings()).isEmpty();
            assertThat(assessment.missingDocuments()).isEmpty();
        }
    }

    @Nested
    @DisplayName("deriveStatus with side data")
    class WithSideData {

        private final List<ExtractedDocument> completeBundle = List.of(
                aMatched(DocumentType.DEVICE_PRESCRIPTION),
                aMatched(DocumentType.AUDIOGRAM),
                aMatched(DocumentType.COMPLIANCE_CERTIFICATE));

        @Test
        @DisplayName("should let rejection override every other stage")
        void shouldLetRejectionOverride() {
            WorkflowSideData side = new WorkflowSideData(true, true, true, true, true, true);

            assertThat(deriver.deriveStatus(completeBundle, side)).isEqualTo(WorkflowStatus.REDDEDILEN);
        }

        @Test
        @DisplayName("should rank payment above invoicing")
        void shouldRankPaymentAboveInvoicing() {
            WorkflowSideData side = new WorkflowSideData(true, true, true, true, true, false);

            assertThat(deriver.deriveStatus(completeBundle, side)).isEqualTo(WorkflowStatus.ODEMESI_ALINDI);
        }

        @Test
        @DisplayName("should rank invoicing above a complete bundle")
        void shouldRankInvoicingAboveCompleteBundle() {
            WorkflowSideData side = new WorkflowSideData(false, false, false, true, false, false);

            assertThat(deriver.deriveStatus(completeBundle, side)).isEqualTo(WorkflowStatus.FATURALANDI);
        }

        @Test
        @DisplayName("should report delivery without documents")
        void shouldReportDeliveryWithoutDocuments() {
            WorkflowSideData side = new WorkflowSideData(true, true, true, false, false, false);

            assertThat(deriver.deriveStatus(List.of(), side)).isEqualTo(WorkflowStatus.MALZEME_TESLIM_EDILDI);
        }

        @Test
        @DisplayName("should report an eligibility query as the earliest stage")
        void shouldReportEligibilityQuery() {
            WorkflowSideData side = new WorkflowSideData(true, false, false, false, false, false);

            assertThat(deriver.deriveStatus(List.of(), side)).isEqualTo(WorkflowStatus.SORGULANDI);
        }

        @Test
        @DisplayName("should not modify its input")
        void shouldNotModifyInput() {
            List<ExtractedDocument> documents = new ArrayList<>(completeBundle);

            WorkflowAssessment first = deriver.assess(documents, WorkflowSideData.none());
            WorkflowAssessment second = deriver.assess(documents, WorkflowSideData.none());

            assertThat(documents).containsExactlyElementsOf(completeBundle);
            assertThat(second).isEqualTo(first);
        }
    }
}
