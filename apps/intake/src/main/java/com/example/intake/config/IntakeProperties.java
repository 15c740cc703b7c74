package com.example.intake.config;

import com.example.intake.storage.LegacyKeyDefinition;
import com.example.intake.storage.LegacyKeyShape;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "intake")
public class IntakeProperties {

    private Matching matching = new Matching();
    private Storage storage = new Storage();
    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Matching {
        private double fuzzyThreshold = 0.6;
        private int minFuzzyLength = 3;
        private int minIdentifierQueryLength = 3;
        private int minIdentifierOverlap = 3;
        private int maxCandidates = 5000;
        private double autoMatchThreshold = 0.6;
        private double ambiguityMargin = 0.05;
        private int maxReportedCandidates = 5;
    }

    @Data
    public static class Storage {
        private String store = "in-memory";  // "in-memory" or "redis"
        private String keyPrefix = "intake:";
        private long limitBytes = 5L * 1024 * 1024;
        private double writeHeadroomRatio = 0.8;
        private double warningRatio = 0.8;
        private int retentionCount = 50;
        private Duration transientMaxAge = Duration.ofHours(24);
        private int ocrTextMaxLength = 1000;
        private long inMemoryCapacityBytes = 0;  // 0 = unbounded medium, quota enforced by StorageManager only
        private boolean migrateOnStartup = true;
        private List<LegacyKeyDefinition> legacyKeys = new ArrayList<>(List.of(
                new LegacyKeyDefinition("sgk_documents", LegacyKeyShape.FLAT_ARRAY),
                new LegacyKeyDefinition("xear_sgk_documents", LegacyKeyShape.FLAT_ARRAY),
                new LegacyKeyDefinition("xear_patients_documents", LegacyKeyShape.PATIENT_KEYED_OBJECT),
                new LegacyKeyDefinition("xear_patient_documents", LegacyKeyShape.PATIENT_KEYED_OBJECT)
        ));
    }

    @Data
    public static class Pipeline {
        private long maxFileSizeBytes = 15L * 1024 * 1024;
        private Duration extractionTimeout = Duration.ofSeconds(60);
        private List<String> supportedContentTypes = List.of(
                "image/jpeg",
                "image/png",
                "image/tiff",
                "application/pdf"
        );
    }
}
