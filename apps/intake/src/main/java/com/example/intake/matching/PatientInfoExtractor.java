package com.example.intake.matching;

import com.example.intake.common.util.StringSanitizer;
import com.example.intake.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls patient identifying fields out of OCR text: national id (TC kimlik no), name,
 * birth date and mobile phone.
 */
@Slf4j
@Component
public class PatientInfoExtractor {

    private static final Locale TURKISH = Locale.forLanguageTag("tr");

    private static final List<Pattern> NATIONAL_ID_PATTERNS = List.of(
            Pattern.compile("(?iu:T\\.?C\\.?K\\.?N\\.?|T\\.?C\\.?|KİMLİK(?:\\s+NO|\\s+NUMARASI)?|KIMLIK(?:\\s+NO|\\s+NUMARASI)?)[\\s.:]*(\\d{11})(?!\\d)"),
            // national ids never start with 0, which keeps bare 11-digit phone numbers out
            Pattern.compile("(?<!\\d)([1-9]\\d{10})(?!\\d)")
    );

    private static final String UPPER_WORD = "[A-ZÇĞİÖŞÜ]{2,}";
    private static final String CAPITALIZED_WORD = "[A-ZÇĞİÖŞÜ][a-zçğıiöşü]{2,}";

    private static final Pattern LABELLED_NAME = Pattern.compile(
            "(?iu:hasta\\s*ad[ıi]?\\s*soyad[ıi]?|ad[ıi]?\\s*soyad[ıi]?)\\s*:\\s*"
                    + "((?:" + UPPER_WORD + "|" + CAPITALIZED_WORD + ")(?:[ \\t]+(?:" + UPPER_WORD + "|" + CAPITALIZED_WORD + ")){1,2})");

    private static final List<Pattern> NAME_PATTERNS = List.of(
            Pattern.compile("(?<!\\p{L})(" + UPPER_WORD + "(?:[ \\t]+" + UPPER_WORD + "){1,2})(?!\\p{L})"),
            Pattern.compile("(?<!\\p{L})(" + CAPITALIZED_WORD + "(?:[ \\t]+" + CAPITALIZED_WORD + "){1,2})(?!\\p{L})")
    );

    private static final List<Pattern> BIRTH_DATE_PATTERNS = List.of(
            Pattern.compile("(?iu:doğum\\s*tarihi?|dogum\\s*tarihi?|birth\\s*date)[\\s:]*(\\d{1,2})[./-](\\d{1,2})[./-](\\d{4})"),
            Pattern.compile("(?<!\\d)(\\d{1,2})[./-](\\d{1,2})[./-](\\d{4})(?!\\d)")
    );

    private static final Pattern PHONE = Pattern.compile(
            "(?<!\\d)0?(5\\d{2})[\\s-]?(\\d{3})[\\s-]?(\\d{2})[\\s-]?(\\d{2})(?!\\d)");

    // Compared after normalization; a name candidate containing any of these is institutional text
    private static final Set<String> NON_NAME_WORDS = Set.of(
            "hastanesi", "hastane", "klinik", "klinigi", "merkezi", "universitesi", "devlet", "saglik",
            "bakanligi", "sosyal", "guvenlik", "kurumu", "sgk", "recete", "recetesi", "rapor", "raporu",
            "tarih", "tarihi", "doktor", "uzm", "hekim", "tc", "kimlik", "no", "hasta", "adi", "soyadi",
            "protokol", "tani", "cihaz", "cihazi", "isitme", "pil", "odyogram", "odyometri", "audiogram",
            "uygunluk", "belgesi", "muayene", "sag", "sol", "kulak", "tedavi", "birimi", "poliklinigi",
            "kbb", "adres", "telefon", "imza", "kase"
    );

    @NonNull
    public ExtractedPatientInfo extract(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return ExtractedPatientInfo.empty();
        }

        double confidence = 0.0;

        String nationalId = findNationalId(text);
        if (nationalId != null) {
            confidence += 0.3;
        }

        String name = findLabelledName(text);
        if (name != null) {
            confidence += 0.6;
        } else {
            name = findUnlabelledName(text);
            if (name != null) {
                confidence += 0.4;
            }
        }

        LocalDate birthDate = findBirthDate(text);
        if (birthDate != null) {
            confidence += 0.1;
        }

        String phone = findPhone(text);

        log.debug("Extracted patient info: nationalId={}, name={}, birthDate={}",
                StringSanitizer.maskIdentifier(nationalId), name != null, birthDate != null);

        return new ExtractedPatientInfo(nationalId, name, birthDate, phone, Math.min(1.0, confidence));
    }

    @Nullable
    private String findNationalId(String text) {
        for (Pattern pattern : NATIONAL_ID_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    @Nullable
    private String findLabelledName(String text) {
        Matcher matcher = LABELLED_NAME.matcher(text);
        while (matcher.find()) {
            String candidate = toDisplayName(matcher.group(1));
            if (isValidName(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    @Nullable
    private String findUnlabelledName(String text) {
        for (Pattern pattern : NAME_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String candidate = toDisplayName(matcher.group(1));
                if (isValidName(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    @Nullable
    private LocalDate findBirthDate(String text) {
        for (Pattern pattern : BIRTH_DATE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                try {
                    return LocalDate.of(
                            Integer.parseInt(matcher.group(3)),
                            Integer.parseInt(matcher.group(2)),
                            Integer.parseInt(matcher.group(1)));
                } catch (DateTimeException e) {
                    log.debug("Skipping invalid date in document text: {}", matcher.group());
                }
            }
        }
        return null;
    }

    @Nullable
    private String findPhone(String text) {
        Matcher matcher = PHONE.matcher(text);
        if (matcher.find()) {
            return "0" + matcher.group(1) + matcher.group(2) + matcher.group(3) + matcher.group(4);
        }
        return null;
    }

    private boolean isValidName(String candidate) {
        List<String> words = TextNormalizer.tokens(candidate);
        if (words.size() < 2) {
            return false;
        }
        return words.stream().noneMatch(NON_NAME_WORDS::contains);
    }

    /**
     * Upper-case OCR names ("ALİ YILMAZ") are title-cased with Turkish casing rules.
     */
    private String toDisplayName(String raw) {
        String collapsed = raw.trim().replaceAll("\\s+", " ");
        if (!collapsed.equals(collapsed.toUpperCase(TURKISH))) {
            return collapsed;
        }
        StringBuilder display = new StringBuilder(collapsed.length());
        for (String word : collapsed.split(" ")) {
            if (display.length() > 0) {
                display.append(' ');
            }
            display.append(word.charAt(0)).append(word.substring(1).toLowerCase(TURKISH));
        }
        return display.toString();
    }
}
