package com.example.intake.text;

import org.springframework.lang.Nullable;

/**
 * Edit-distance based string similarity shared by document classification and patient matching.
 * <p>
 * Each comparison is O(|a|·|b|); callers are expected to bound the number of comparisons
 * per request (see {@code intake.matching.max-candidates}).
 */
public final class TextSimilarity {

    private TextSimilarity() {}

    /**
     * Classic Levenshtein distance with unit cost for insertion, deletion and substitution.
     */
    public static int distance(@Nullable String a, @Nullable String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        if (left.isEmpty()) {
            return right.length();
        }
        if (right.isEmpty()) {
            return left.length();
        }

        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            char lc = left.charAt(i - 1);
            for (int j = 1; j <= right.length(); j++) {
                int cost = lc == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }

    /**
     * {@code 1 - distance / max(len(a), len(b))}; two empty strings are identical,
     * an empty string against a non-empty one scores 0.
     */
    public static double similarity(@Nullable String a, @Nullable String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        return 1.0 - (double) distance(left, right) / longest;
    }

    /**
     * Containment after normalization always wins; the fuzzy fallback is only attempted for
     * queries of at least {@code minLength} characters.
     */
    public static boolean isMatch(@Nullable String query, @Nullable String text, double threshold, int minLength) {
        String q = TextNormalizer.normalize(query);
        String t = TextNormalizer.normalize(text);
        if (t.contains(q)) {
            return true;
        }
        if (q.length() < minLength) {
            return false;
        }
        return bestTokenSimilarity(q, t) >= threshold;
    }

    /**
     * Best similarity of the normalized query against the whole normalized text or any of its tokens.
     */
    public static double bestTokenSimilarity(@Nullable String query, @Nullable String text) {
        String q = TextNormalizer.normalize(query);
        String t = TextNormalizer.normalize(text);
        double best = similarity(q, t);
        for (String token : TextNormalizer.tokens(t)) {
            best = Math.max(best, similarity(q, token));
            if (best >= 1.0) {
                break;
            }
        }
        return best;
    }
}
