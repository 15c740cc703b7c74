package com.example.intake.storage;

import com.example.intake.classification.DocumentType;
import com.example.intake.config.IntakeProperties;
import com.example.intake.pipeline.DocumentStatus;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Maps records written by earlier releases onto {@link StoredDocument}.
 * <p>
 * Earlier releases used several field spellings for the same data ({@code filename},
 * {@code fileName}, {@code originalName}; {@code uploadDate}, {@code saveDate}; OCR text at the top
 * level or under {@code ocrData}); each field is read from the first spelling present.
 * Records without an id get a stable id derived from their content.
 */
@Slf4j
@Component
public class LegacyDocumentMapper {

    static final String SOURCE = "legacy_migration";

    private static final Set<String> LEGACY_HANDLED_STATUSES = Set.of("processed", "processed_local", "uploaded");

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));

    private final int ocrTextMaxLength;

    public LegacyDocumentMapper(IntakeProperties properties) {
        this.ocrTextMaxLength = properties.getStorage().getOcrTextMaxLength();
    }

    /**
     * @throws IllegalArgumentException when the value does not have the registered shape
     */
    public List<StoredDocument> map(LegacyKeyDefinition definition, JsonNode root) {
        List<StoredDocument> documents = new ArrayList<>();
        switch (definition.shape()) {
            case FLAT_ARRAY -> {
                if (!root.isArray()) {
                    throw new IllegalArgumentException("expected a JSON array, found " + root.getNodeType());
                }
                root.forEach(record -> mapRecord(record, null, documents));
            }
            case PATIENT_KEYED_OBJECT -> {
                if (!root.isObject()) {
                    throw new IllegalArgumentException("expected a JSON object, found " + root.getNodeType());
                }
                Iterator<Map.Entry<String, JsonNode>> patients = root.fields();
                while (patients.hasNext()) {
                    Map.Entry<String, JsonNode> patient = patients.next();
                    if (!patient.getValue().isArray()) {
                        log.warn("Skipping non-array entry for patient {} in {}", patient.getKey(), definition.key());
                        continue;
                    }
                    patient.getValue().forEach(record -> mapRecord(record, patient.getKey(), documents));
                }
            }
        }
        log.debug("Read {} legacy records from {}", documents.size(), definition.key());
        return documents;
    }

    private void mapRecord(JsonNode record, @Nullable String keyedPatientId, List<StoredDocument> out) {
        if (!record.isObject()) {
            log.debug("Skipping non-object legacy record");
            return;
        }

        String patientId = keyedPatientId != null
                ? keyedPatientId
                : firstText(record, "patientId", "patientMatch.patientId", "matchedPatient.id");
        DocumentStatus status = statusOf(firstText(record, "status"), patientId);

        out.add(StoredDocument.builder()
                .id(idOf(record))
                .fileName(firstText(record, "filename", "fileName", "originalName", "name"))
                .suggestedName(firstText(record, "suggestedName"))
                .contentType(contentTypeOf(record))
                .patientId(patientId)
                .patientName(firstText(record, "patientName", "patientMatch.patientName", "matchedPatient.name"))
                .documentType(documentTypeOf(record))
                .documentTypeConfidence(firstDouble(record,
                        "documentType.confidence", "ocrData.classification.confidence"))
                .status(status)
                .ocrText(truncate(firstText(record, "ocrText", "ocrData.text", "extractedText")))
                .ocrConfidence(firstDouble(record, "ocrConfidence", "ocrData.confidence"))
                .matchConfidence(firstDouble(record, "patientMatch.matchConfidence", "matchedPatient.matchConfidence"))
                .sizeBytes((long) firstDouble(record, "originalSize", "size", "sizeBytes", "fileSize"))
                .uploadedAt(parseInstant(firstText(record, "uploadDate", "saveDate", "processingDate", "uploadedAt")))
                .source(SOURCE)
                .fileData(firstText(record, "fileData", "originalImage"))
                .croppedImage(firstText(record, "croppedImage"))
                .compressedPdf(firstText(record, "compressedPDF", "pdfData"))
                .hasImage(record.hasNonNull("hasImage") ? record.get("hasImage").asBoolean() : null)
                .hasPdf(record.hasNonNull("hasPDF") ? record.get("hasPDF").asBoolean() : null)
                .build());
    }

    /**
     * Upload-era statuses ({@code processed}, {@code processed_local}, {@code uploaded}) only said the
     * file had been handled; the patient id decides whether the record was assigned.
     */
    static DocumentStatus statusOf(@Nullable String code, @Nullable String patientId) {
        if (code == null || LEGACY_HANDLED_STATUSES.contains(code.trim().toLowerCase(Locale.ROOT))) {
            return patientId != null ? DocumentStatus.AUTO_MATCHED : DocumentStatus.MANUAL_REVIEW;
        }
        return DocumentStatus.fromCode(code);
    }

    private static DocumentType documentTypeOf(JsonNode record) {
        String code = firstText(record, "documentType.type", "ocrData.classification.type", "documentType");
        if (code == null) {
            String type = firstText(record, "type");
            code = type != null && !type.contains("/") ? type : null;
        }
        return DocumentType.fromCode(code);
    }

    private static String idOf(JsonNode record) {
        String id = firstText(record, "id");
        if (id != null) {
            return id;
        }
        return "legacy-" + UUID.nameUUIDFromBytes(record.toString().getBytes(StandardCharsets.UTF_8));
    }

    @Nullable
    private static String contentTypeOf(JsonNode record) {
        String fileType = firstText(record, "fileType", "contentType");
        if (fileType != null) {
            return fileType;
        }
        // "type" was a MIME type in some releases and a document type code in others
        String type = firstText(record, "type");
        return type != null && type.contains("/") ? type : null;
    }

    @Nullable
    private String truncate(@Nullable String text) {
        if (text == null || text.length() <= ocrTextMaxLength) {
            return text;
        }
        return text.substring(0, ocrTextMaxLength);
    }

    @Nullable
    static Instant parseInstant(@Nullable String value) {
        if (value == null) {
            return null;
        }
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                log.trace("Legacy date '{}' not in format: {}", value, e.getMessage());
            }
        }
        log.debug("Unparseable legacy date '{}'", value);
        return null;
    }

    /**
     * First non-blank value among dotted paths; numbers are rendered as text.
     */
    @Nullable
    private static String firstText(JsonNode record, String... paths) {
        for (String path : paths) {
            JsonNode node = at(record, path);
            if (node != null && node.isValueNode() && !node.isNull()) {
                String text = node.asText();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }

    private static double firstDouble(JsonNode record, String... paths) {
        for (String path : paths) {
            JsonNode node = at(record, path);
            if (node != null && node.isNumber()) {
                return node.asDouble();
            }
        }
        return 0.0;
    }

    @Nullable
    private static JsonNode at(JsonNode record, String path) {
        JsonNode current = record;
        for (String segment : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }
}
