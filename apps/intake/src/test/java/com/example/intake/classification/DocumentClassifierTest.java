package com.example.intake.classification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("DocumentClassifier")
class DocumentClassifierTest {

    private final DocumentClassifier classifier = new DocumentClassifier();

    @Nested
    @DisplayName("classify from text")
    class ClassifyFromText {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', textBlock = """
                PİL REÇETESİ                          | BATTERY_PRESCRIPTION   | 0.9
                İşitme Cihazı Reçetesi                 | DEVICE_PRESCRIPTION    | 0.9
                E-Reçete No: 1234                      | DEVICE_PRESCRIPTION    | 0.7
                ODYOMETRİ SONUÇLARI                    | AUDIOGRAM              | 0.95
                Sağ kulak audiogram                    | AUDIOGRAM              | 0.95
                Cihaz Uygunluk Belgesi                 | COMPLIANCE_CERTIFICATE | 0.9
                SGK sağlık kurulu raporu               | COMPLIANCE_CERTIFICATE | 0.9
                KBB Muayene Raporu                     | ADMINISTRATIVE_REPORT  | 0.85
                """)
        @DisplayName("should apply the first matching rule")
        void shouldApplyFirstMatchingRule(String text, DocumentType expectedType, double expectedConfidence) {
            DocumentClassification result = classifier.classify(text);

            assertThat(result.type()).isEqualTo(expectedType);
            assertThat(result.confidence()).isCloseTo(expectedConfidence, within(1e-9));
            assertThat(result.method()).isEqualTo(DocumentClassification.METHOD_TEXT_PATTERN);
        }

        @Test
        @DisplayName("should prefer battery over device when a prescription mentions both")
        void shouldPreferBatteryOverDevice() {
            DocumentClassification result = classifier.classify("İşitme cihazı pil reçetesi");

            assertThat(result.type()).isEqualTo(DocumentType.BATTERY_PRESCRIPTION);
        }

        @Test
        @DisplayName("should prefer prescription over audiogram")
        void shouldPreferPrescriptionOverAudiogram() {
            DocumentClassification result = classifier.classify("Odyogram sonucuna göre cihaz reçete edilmiştir");

            assertThat(result.type()).isEqualTo(DocumentType.DEVICE_PRESCRIPTION);
        }
    }

    @Nested
    @DisplayName("classify from file name")
    class ClassifyFromFileName {

        @Test
        @DisplayName("should fall back to the file name with reduced confidence")
        void shouldFallBackToFileName() {
            DocumentClassification result = classifier.classify("lorem ipsum", "odyogram_2024.pdf");

            assertThat(result.type()).isEqualTo(DocumentType.AUDIOGRAM);
            assertThat(result.confidence())
                    .isCloseTo(0.95 * DocumentClassifier.FILE_NAME_CONFIDENCE_FACTOR, within(1e-9));
            assertThat(result.method()).isEqualTo(DocumentClassification.METHOD_FILENAME_PATTERN);
        }

        @Test
        @DisplayName("should prefer text over file name")
        void shouldPreferTextOverFileName() {
            DocumentClassification result = classifier.classify("Uygunluk belgesi", "recete.pdf");

            assertThat(result.type()).isEqualTo(DocumentType.COMPLIANCE_CERTIFICATE);
            assertThat(result.method()).isEqualTo(DocumentClassification.METHOD_TEXT_PATTERN);
        }
    }

    @Nested
    @DisplayName("totality")
    class Totality {

        @Test
        @DisplayName("should return OTHER with zero confidence for unknown text")
        void shouldReturnOtherForUnknownText() {
            DocumentClassification result = classifier.classify("lorem ipsum dolor", "scan001.pdf");

            assertThat(result.type()).isEqualTo(DocumentType.OTHER);
            assertThat(result.confidence()).isZero();
            assertThat(result.method()).isEqualTo(DocumentClassification.METHOD_DEFAULT);
        }

        @Test
        @DisplayName("should return OTHER for null text and file name")
        void shouldReturnOtherForNullInput() {
            assertThat(classifier.classify(null, null)).isEqualTo(DocumentClassification.unclassified());
        }

        @Test
        @DisplayName("should return the same result for the same input")
        void shouldBeDeterministic() {
            String text = "KBB Muayene Raporu\nHasta: ALİ YILMAZ";

            assertThat(classifier.classify(text, "a.pdf")).isEqualTo(classifier.classify(text, "a.pdf"));
        }
    }
}
