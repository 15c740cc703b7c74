package com.example.intake.matching;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Result of reconciling one document's extracted patient info against the candidate set.
 * Exactly one of {@code match} and {@code reviewReason} is non-null.
 */
public record MatchDecision(
        @Nullable MatchResult match,
        @Nullable ReviewReason reviewReason,
        List<MatchResult> candidates
) {
    public MatchDecision {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static MatchDecision autoMatched(MatchResult match, List<MatchResult> candidates) {
        return new MatchDecision(match, null, candidates);
    }

    public static MatchDecision manualReview(ReviewReason reason, List<MatchResult> candidates) {
        return new MatchDecision(null, reason, candidates);
    }

    public boolean isAutoMatched() {
        return match != null;
    }
}
