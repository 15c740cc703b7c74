package com.example.intake.text;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes text for comparison: Turkish diacritics folded to their ASCII base letter,
 * lower-cased, whitespace collapsed and trimmed.
 * Every method is total; {@code null} input yields an empty result.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    private TextNormalizer() {}

    @NonNull
    public static String normalize(@Nullable String text) {
        return normalize(text, false);
    }

    @NonNull
    public static String normalize(@Nullable String text, boolean caseSensitive) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder folded = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            folded.append(foldDiacritic(text.charAt(i), caseSensitive));
        }
        String result = WHITESPACE.matcher(folded).replaceAll(" ").trim();
        // ROOT keeps 'I' -> 'i' regardless of the JVM default locale
        return caseSensitive ? result : result.toLowerCase(Locale.ROOT);
    }

    /**
     * Strips every non-digit character, used for national identifier and phone comparison.
     */
    @NonNull
    public static String digitsOnly(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return NON_DIGIT.matcher(text).replaceAll("");
    }

    @NonNull
    public static List<String> tokens(@Nullable String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }

    private static char foldDiacritic(char c, boolean caseSensitive) {
        return switch (c) {
            case 'ç' -> 'c';
            case 'ğ' -> 'g';
            case 'ı' -> 'i';
            case 'ö' -> 'o';
            case 'ş' -> 's';
            case 'ü' -> 'u';
            case 'Ç' -> caseSensitive ? 'C' : 'c';
            case 'Ğ' -> caseSensitive ? 'G' : 'g';
            case 'İ' -> caseSensitive ? 'I' : 'i';
            case 'Ö' -> caseSensitive ? 'O' : 'o';
            case 'Ş' -> caseSensitive ? 'S' : 's';
            case 'Ü' -> caseSensitive ? 'U' : 'u';
            default -> c;
        };
    }
}
