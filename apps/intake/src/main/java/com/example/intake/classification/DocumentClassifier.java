package com.example.intake.classification;

import com.example.intake.common.util.StringSanitizer;
import com.example.intake.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

/**
 * Keyword-based document classifier.
 * <p>
 * Rules are evaluated in order against the normalized extracted text; the first match wins.
 * When the text matches nothing, the same rules are tried on the file name with reduced
 * confidence. Classification is total and deterministic: unknown input yields
 * {@link DocumentType#OTHER} with confidence 0.
 */
@Slf4j
@Component
public class DocumentClassifier {

    static final double FILE_NAME_CONFIDENCE_FACTOR = 0.6;

    private static final List<Rule> RULES = List.of(
            new Rule(DocumentType.BATTERY_PRESCRIPTION, 0.9,
                    text -> mentionsPrescription(text) && text.contains("pil")),
            new Rule(DocumentType.DEVICE_PRESCRIPTION, 0.9,
                    text -> mentionsPrescription(text) && (text.contains("cihaz") || text.contains("isitme"))),
            new Rule(DocumentType.DEVICE_PRESCRIPTION, 0.7,
                    DocumentClassifier::mentionsPrescription),
            new Rule(DocumentType.AUDIOGRAM, 0.95,
                    text -> text.contains("odyogram") || text.contains("audiogram")
                            || text.contains("odyometri") || text.contains("audiometri") || text.contains("odyo")),
            new Rule(DocumentType.COMPLIANCE_CERTIFICATE, 0.9,
                    text -> text.contains("uygunluk") || (text.contains("rapor") && text.contains("sgk"))),
            new Rule(DocumentType.ADMINISTRATIVE_REPORT, 0.85,
                    text -> text.contains("muayene") && text.contains("rapor"))
    );

    @NonNull
    public DocumentClassification classify(@Nullable String text) {
        return classify(text, null);
    }

    @NonNull
    public DocumentClassification classify(@Nullable String text, @Nullable String fileName) {
        String normalizedText = TextNormalizer.normalize(text);
        for (Rule rule : RULES) {
            if (rule.matcher().test(normalizedText)) {
                log.debug("Classified document as {} from text", rule.type());
                return new DocumentClassification(rule.type(), rule.confidence(),
                        DocumentClassification.METHOD_TEXT_PATTERN);
            }
        }

        String normalizedName = TextNormalizer.normalize(fileName).replace('_', ' ');
        if (!normalizedName.isEmpty()) {
            for (Rule rule : RULES) {
                if (rule.matcher().test(normalizedName)) {
                    log.debug("Classified document as {} from file name {}",
                            rule.type(), StringSanitizer.forLog(fileName));
                    return new DocumentClassification(rule.type(),
                            rule.confidence() * FILE_NAME_CONFIDENCE_FACTOR,
                            DocumentClassification.METHOD_FILENAME_PATTERN);
                }
            }
        }

        return DocumentClassification.unclassified();
    }

    private static boolean mentionsPrescription(String text) {
        return text.contains("recete");
    }

    private record Rule(DocumentType type, double confidence, Predicate<String> matcher) {}
}
