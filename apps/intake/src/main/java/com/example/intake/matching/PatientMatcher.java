package com.example.intake.matching;

import com.example.intake.common.util.StringSanitizer;
import com.example.intake.config.IntakeProperties;
import com.example.intake.text.TextNormalizer;
import com.example.intake.text.TextSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ranks registry candidates against a query and decides whether a document can be
 * reconciled to a patient without human review.
 * <p>
 * Identifier queries (digits and separators only) score in disjoint bands so that an exact
 * identifier always outranks a suffix hit, which always outranks a mid-string hit:
 * exact = 1.0, suffix in (0.5, 0.9], substring in (0.1, 0.4]. Text queries score exact-tier
 * matches in [0.5, 1.0] and fuzzy-tier matches in [0, 0.5].
 */
@Slf4j
@Component
public class PatientMatcher {

    private static final Pattern IDENTIFIER_QUERY = Pattern.compile("[\\d\\s.\\-/]+");
    private static final int MAX_RANKED_DIGITS = 11;
    private static final double SUFFIX_BAND_FLOOR = 0.5;
    private static final double SUFFIX_BAND_WIDTH = 0.4;
    private static final double SUBSTRING_BAND_FLOOR = 0.1;
    private static final double SUBSTRING_BAND_WIDTH = 0.3;

    private final IntakeProperties.Matching settings;

    public PatientMatcher(IntakeProperties properties) {
        this.settings = properties.getMatching();
    }

    /**
     * Filters and ranks candidates for a free-form query. A blank query returns every candidate
     * unranked, in input order.
     */
    @NonNull
    public List<MatchResult> search(@Nullable String query, @Nullable List<PatientCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<PatientCandidate> bounded = bound(candidates);

        String normalizedQuery = TextNormalizer.normalize(query);
        if (normalizedQuery.isEmpty()) {
            return bounded.stream()
                    .map(candidate -> MatchResult.of(candidate, 0.0, MatchType.UNFILTERED, 0))
                    .toList();
        }

        if (isIdentifierQuery(normalizedQuery)) {
            List<MatchResult> identifierHits = searchByIdentifier(TextNormalizer.digitsOnly(normalizedQuery), bounded);
            if (!identifierHits.isEmpty()) {
                return identifierHits;
            }
            log.debug("No identifier hits for query, falling back to text search");
        }

        return searchByText(normalizedQuery, bounded);
    }

    /**
     * Decides whether the extracted info identifies exactly one candidate with enough confidence.
     * An exact national id hit wins outright; a partial identifier overlap alone never auto-matches.
     * Otherwise the name is searched and the best result
     * must clear the auto-match threshold by more than the ambiguity margin over the runner-up.
     */
    @NonNull
    public MatchDecision match(@Nullable ExtractedPatientInfo info, @Nullable List<PatientCandidate> candidates) {
        if (info == null || info.isEmpty()) {
            return MatchDecision.manualReview(ReviewReason.NO_PATIENT_INFO, List.of());
        }
        if (candidates == null || candidates.isEmpty()) {
            return MatchDecision.manualReview(ReviewReason.NO_CANDIDATES, List.of());
        }

        List<MatchResult> identifierResults = List.of();
        if (info.hasNationalId()) {
            identifierResults = search(info.nationalId(), candidates);
            if (!identifierResults.isEmpty() && identifierResults.get(0).matchType() == MatchType.EXACT) {
                log.debug("Auto-matched by national id {}", StringSanitizer.maskIdentifier(info.nationalId()));
                return MatchDecision.autoMatched(identifierResults.get(0), top(identifierResults));
            }
        }
        if (!info.hasName()) {
            // partial identifier overlaps are suggestions only, never an assignment
            log.debug("No exact national id hit and no name, {} partial identifier candidates", identifierResults.size());
            return MatchDecision.manualReview(ReviewReason.BELOW_THRESHOLD, top(identifierResults));
        }

        List<MatchResult> results = search(info.name(), candidates);
        if (results.isEmpty()) {
            return MatchDecision.manualReview(ReviewReason.BELOW_THRESHOLD, List.of());
        }

        MatchResult best = results.get(0);
        if (best.score() < settings.getAutoMatchThreshold()) {
            log.debug("Best candidate score {} below auto-match threshold {}",
                    best.score(), settings.getAutoMatchThreshold());
            return MatchDecision.manualReview(ReviewReason.BELOW_THRESHOLD, top(results));
        }
        if (results.size() > 1 && best.score() - results.get(1).score() < settings.getAmbiguityMargin()) {
            log.debug("Top candidates within ambiguity margin: {} vs {}", best.score(), results.get(1).score());
            return MatchDecision.manualReview(ReviewReason.TOO_CLOSE_TO_CALL, top(results));
        }
        return MatchDecision.autoMatched(best, top(results));
    }

    private List<MatchResult> searchByIdentifier(String digits, List<PatientCandidate> candidates) {
        List<MatchResult> results = new ArrayList<>();
        for (PatientCandidate candidate : candidates) {
            String identifier = TextNormalizer.digitsOnly(candidate.nationalId());
            if (identifier.isEmpty()) {
                continue;
            }
            if (identifier.equals(digits)) {
                results.add(MatchResult.of(candidate, 1.0, MatchType.EXACT, digits.length()));
                continue;
            }
            int overlap = identifier.endsWith(digits) ? digits.length() : commonSuffixLength(identifier, digits);
            if (overlap == digits.length() || overlap >= settings.getMinIdentifierOverlap()) {
                results.add(MatchResult.of(candidate, suffixScore(overlap), MatchType.IDENTIFIER_SUFFIX, overlap));
            } else if (identifier.contains(digits)) {
                results.add(MatchResult.of(candidate, substringScore(digits.length()),
                        MatchType.IDENTIFIER_SUBSTRING, digits.length()));
            }
        }
        results.sort(MatchResult.RANKING);
        return results;
    }

    private List<MatchResult> searchByText(String normalizedQuery, List<PatientCandidate> candidates) {
        List<String> queryTokens = TextNormalizer.tokens(normalizedQuery);
        List<MatchResult> results = new ArrayList<>();

        for (PatientCandidate candidate : candidates) {
            List<String> candidateTokens = TextNormalizer.tokens(candidate.searchableText());
            if (candidateTokens.isEmpty()) {
                continue;
            }

            boolean allVerbatim = true;
            boolean allMatched = true;
            double similaritySum = 0.0;
            for (String queryToken : queryTokens) {
                boolean verbatim = false;
                boolean fuzzy = false;
                double best = 0.0;
                for (String candidateToken : candidateTokens) {
                    if (candidateToken.contains(queryToken)) {
                        verbatim = true;
                    } else if (!fuzzy && TextSimilarity.isMatch(queryToken, candidateToken,
                            settings.getFuzzyThreshold(), settings.getMinFuzzyLength())) {
                        fuzzy = true;
                    }
                    best = Math.max(best, TextSimilarity.similarity(queryToken, candidateToken));
                }
                if (!verbatim && !fuzzy) {
                    allMatched = false;
                    break;
                }
                allVerbatim &= verbatim;
                similaritySum += best;
            }
            if (!allMatched) {
                continue;
            }

            double average = similaritySum / queryTokens.size();
            if (allVerbatim) {
                results.add(MatchResult.of(candidate, 0.5 + 0.5 * average, MatchType.EXACT, 0));
            } else {
                results.add(MatchResult.of(candidate, 0.5 * average, MatchType.FUZZY, 0));
            }
        }

        results.sort(MatchResult.RANKING);
        log.debug("Text search for '{}' matched {} of {} candidates",
                StringSanitizer.forLog(normalizedQuery), results.size(), candidates.size());
        return results;
    }

    private boolean isIdentifierQuery(String normalizedQuery) {
        return IDENTIFIER_QUERY.matcher(normalizedQuery).matches()
                && TextNormalizer.digitsOnly(normalizedQuery).length() >= settings.getMinIdentifierQueryLength();
    }

    private List<PatientCandidate> bound(List<PatientCandidate> candidates) {
        if (candidates.size() <= settings.getMaxCandidates()) {
            return candidates;
        }
        log.warn("Candidate set of {} exceeds limit {}, truncating", candidates.size(), settings.getMaxCandidates());
        return candidates.subList(0, settings.getMaxCandidates());
    }

    private List<MatchResult> top(List<MatchResult> results) {
        return results.subList(0, Math.min(results.size(), settings.getMaxReportedCandidates()));
    }

    // rank 3 + min(k, 11) lies in [4, 14]; mapped into (0.5, 0.9]
    private static double suffixScore(int overlap) {
        int rank = 3 + Math.min(overlap, MAX_RANKED_DIGITS);
        return SUFFIX_BAND_FLOOR + SUFFIX_BAND_WIDTH * rank / (3.0 + MAX_RANKED_DIGITS);
    }

    // rank 1 + min(len, 11) lies in [2, 12]; mapped into (0.1, 0.4]
    private static double substringScore(int length) {
        int rank = 1 + Math.min(length, MAX_RANKED_DIGITS);
        return SUBSTRING_BAND_FLOOR + SUBSTRING_BAND_WIDTH * rank / (1.0 + MAX_RANKED_DIGITS);
    }

    static int commonSuffixLength(String a, String b) {
        int i = a.length() - 1;
        int j = b.length() - 1;
        int length = 0;
        while (i >= 0 && j >= 0 && a.charAt(i) == b.charAt(j)) {
            length++;
            i--;
            j--;
        }
        return length;
    }
}
