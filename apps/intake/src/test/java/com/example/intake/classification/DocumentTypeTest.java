package com.example.intake.classification;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentType")
class DocumentTypeTest {

    private final Locale defaultLocale = Locale.getDefault();

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(defaultLocale);
    }

    @Nested
    @DisplayName("fromCode")
    class FromCode {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "audiogram, AUDIOGRAM",
                "odyogram, AUDIOGRAM",
                "odyo, AUDIOGRAM",
                "uygunluk, COMPLIANCE_CERTIFICATE",
                "uygunluk_belgesi, COMPLIANCE_CERTIFICATE",
                "muayene_raporu, ADMINISTRATIVE_REPORT",
                "recete, DEVICE_PRESCRIPTION",
                "pil_recete, BATTERY_PRESCRIPTION",
                "unheard_of, OTHER"
        })
        @DisplayName("should accept current and legacy codes")
        void shouldAcceptLegacyCodes(String code, DocumentType expected) {
            assertThat(DocumentType.fromCode(code)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should fold case independently of the default locale")
        void shouldFoldCaseIndependentlyOfLocale() {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));

            assertThat(DocumentType.fromCode("CIHAZ_RECETE")).isEqualTo(DocumentType.DEVICE_PRESCRIPTION);
            assertThat(DocumentType.fromCode(" UYGUNLUK_BELGESI ")).isEqualTo(DocumentType.COMPLIANCE_CERTIFICATE);
        }

        @Test
        @DisplayName("should fall back to other for a missing code")
        void shouldFallBackForMissingCode() {
            assertThat(DocumentType.fromCode(null)).isEqualTo(DocumentType.OTHER);
            assertThat(DocumentType.fromCode("  ")).isEqualTo(DocumentType.OTHER);
        }
    }
}
