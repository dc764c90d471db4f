package io.eligian.core.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Bounded Levenshtein distance over Unicode code points, used for "did you mean" suggestions.
 */
public final class EditDistance {

    /** Largest distance still offered as a suggestion. */
    public static final int MAX_SUGGESTION_DISTANCE = 2;

    /** Maximum number of suggestions returned. */
    public static final int MAX_SUGGESTIONS = 3;

    private EditDistance() {}

    /**
     * Computes the edit distance between {@code a} and {@code b}, giving up once it is known to
     * exceed {@code max}.
     *
     * @return the distance, or {@code max + 1} if it is larger than {@code max}
     */
    public static int distance(String a, String b, int max) {
        int[] s = a.codePoints().toArray();
        int[] t = b.codePoints().toArray();
        if (Math.abs(s.length - t.length) > max) {
            return max + 1;
        }
        int[] previous = new int[t.length + 1];
        int[] current = new int[t.length + 1];
        for (int j = 0; j <= t.length; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= s.length; i++) {
            current[0] = i;
            int rowMin = current[0];
            for (int j = 1; j <= t.length; j++) {
                int cost = s[i - 1] == t[j - 1] ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
                rowMin = Math.min(rowMin, current[j]);
            }
            if (rowMin > max) {
                return max + 1;
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return Math.min(previous[t.length], max + 1);
    }

    /**
     * Returns up to {@link #MAX_SUGGESTIONS} candidates within {@link #MAX_SUGGESTION_DISTANCE} of
     * {@code name}, nearest first, ties broken alphabetically. Comparison is case-sensitive.
     */
    public static List<String> suggestions(String name, Collection<String> candidates) {
        List<Match> matches = new ArrayList<>();
        for (String candidate : candidates) {
            int d = distance(name, candidate, MAX_SUGGESTION_DISTANCE);
            if (d <= MAX_SUGGESTION_DISTANCE) {
                matches.add(new Match(candidate, d));
            }
        }
        return matches.stream()
                .sorted(Comparator.comparingInt(Match::distance).thenComparing(Match::candidate))
                .limit(MAX_SUGGESTIONS)
                .map(Match::candidate)
                .collect(Collectors.toList());
    }

    private record Match(String candidate, int distance) {}
}
