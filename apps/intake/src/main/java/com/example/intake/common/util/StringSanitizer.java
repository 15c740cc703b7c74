package com.example.intake.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

public final class StringSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");
    private static final Pattern SAFE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_.:-]{1,128}$");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final int VISIBLE_IDENTIFIER_DIGITS = 4;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    /**
     * Drops control characters, line breaks included, and truncates to {@code maxLength}.
     */
    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = CONTROL_CHARS.matcher(value).replaceAll("");
        return sanitized.length() <= maxLength ? sanitized : sanitized.substring(0, maxLength);
    }

    /**
     * Masks a national identifier for logs, keeping only the last four digits.
     */
    @NonNull
    public static String maskIdentifier(@Nullable String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return "";
        }
        if (identifier.length() <= VISIBLE_IDENTIFIER_DIGITS) {
            return "*".repeat(identifier.length());
        }
        int hidden = identifier.length() - VISIBLE_IDENTIFIER_DIGITS;
        return "*".repeat(hidden) + identifier.substring(hidden);
    }

    public static boolean isValidSafeId(@Nullable String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        return SAFE_ID_PATTERN.matcher(id).matches();
    }
}
