package com.example.intake.common.util;

import com.example.intake.text.TextNormalizer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds export file names of the form {@code Ali_Yilmaz_Odyogram_2024-03-01.pdf}.
 */
public final class DocumentNames {

    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9\\s]");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final String UNKNOWN_PATIENT = "Bilinmeyen_Hasta";
    private static final String DEFAULT_TYPE = "Belge";
    private static final String DEFAULT_EXTENSION = "pdf";

    private DocumentNames() {}

    @NonNull
    public static String suggestedName(@Nullable String patientName,
                                       @Nullable String documentTypeLabel,
                                       @Nullable String originalFileName,
                                       @NonNull LocalDate date) {
        String patient = clean(patientName);
        String type = clean(documentTypeLabel);
        return (patient.isEmpty() ? UNKNOWN_PATIENT : patient)
                + "_" + (type.isEmpty() ? DEFAULT_TYPE : type)
                + "_" + date
                + "." + extensionOf(originalFileName);
    }

    private static String clean(@Nullable String value) {
        String ascii = TextNormalizer.normalize(value, true);
        return SPACES.matcher(UNSAFE.matcher(ascii).replaceAll("").trim()).replaceAll("_");
    }

    private static String extensionOf(@Nullable String fileName) {
        if (fileName == null) {
            return DEFAULT_EXTENSION;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
