package com.example.intake.matching;

import java.util.Comparator;

/**
 * One scored candidate.
 *
 * @param patientId          id of the matched candidate
 * @param candidate          the candidate itself
 * @param score              relevance in [0, 1]
 * @param matchType          how the candidate matched
 * @param identifierOverlap  number of identifier digits shared with the query; 0 for text matches
 */
public record MatchResult(
        String patientId,
        PatientCandidate candidate,
        double score,
        MatchType matchType,
        int identifierOverlap
) {
    /**
     * Score descending, then exact matches first, then longest identifier overlap, then display name.
     */
    public static final Comparator<MatchResult> RANKING = Comparator
            .comparingDouble(MatchResult::score).reversed()
            .thenComparing(result -> result.matchType() == MatchType.EXACT ? 0 : 1)
            .thenComparing(Comparator.comparingInt(MatchResult::identifierOverlap).reversed())
            .thenComparing(result -> result.candidate().displayName() == null ? "" : result.candidate().displayName());

    public static MatchResult of(PatientCandidate candidate, double score, MatchType matchType, int identifierOverlap) {
        return new MatchResult(candidate.id(), candidate, score, matchType, identifierOverlap);
    }
}
