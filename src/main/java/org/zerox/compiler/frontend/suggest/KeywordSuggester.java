package org.zerox.compiler.frontend.suggest;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Produces "did you mean" hints for words the parser rejects in a keyword position.
 * <p>
 * Known idioms from other UI ecosystems are looked up in {@link #COMMON_MISTAKES} first;
 * otherwise the closest candidate keyword by edit distance is proposed, provided it is within
 * the configured maximum distance.
 */
public final class KeywordSuggester {

    /** The default maximum edit distance for a suggestion. */
    public static final int DEFAULT_MAX_DISTANCE = 2;

    /**
     * Hints for words that are valid in other frameworks but not in 0x.
     */
    public static final Map<String, String> COMMON_MISTAKES;

    static {
        Map<String, String> mistakes = new LinkedHashMap<>();
        mistakes.put("onMount", "Use 'on mount:' for lifecycle hooks.");
        mistakes.put("onDestroy", "Use 'on destroy:' for cleanup hooks.");
        mistakes.put("useEffect", "Use 'on mount:' or 'watch variable:' instead of useEffect.");
        mistakes.put("useState", "Use 'state name: type = value' instead of useState.");
        mistakes.put("className", "Use a '.class' style token or 'class=' prop instead of className.");
        mistakes.put("onClick", "Use 'button \"label\" -> action' for click handlers.");
        mistakes.put("onChange", "Use 'input binding' for two-way bound inputs.");
        mistakes.put("div", "Use 'layout col:' or 'layout row:' instead of div.");
        mistakes.put("span", "Use 'text \"...\"' instead of span.");
        mistakes.put("p", "Use 'text \"...\"' instead of p.");
        mistakes.put("h1", "Use 'text \"...\" size=3xl bold' instead of h1.");
        mistakes.put("h2", "Use 'text \"...\" size=2xl bold' instead of h2.");
        mistakes.put("h3", "Use 'text \"...\" size=xl bold' instead of h3.");
        mistakes.put("img", "Use 'image \"src\"' instead of img.");
        mistakes.put("a", "Use 'link \"label\" href=\"/path\"' instead of a.");
        mistakes.put("var", "Use 'state name: type = value' to declare reactive variables.");
        mistakes.put("let", "Use 'state name: type = value' to declare reactive variables.");
        mistakes.put("const", "Use 'state' for reactive values or 'derived' for computed values.");
        mistakes.put("function", "Use 'fn name():' to declare functions.");
        mistakes.put("def", "Use 'fn name():' to declare functions.");
        mistakes.put("elif", "'elif' must follow an 'if' block.");
        mistakes.put("else", "'else' must follow an 'if' block.");
        COMMON_MISTAKES = Collections.unmodifiableMap(mistakes);
    }

    private final int maxDistance;

    /**
     * Creates a suggester with the default maximum distance.
     */
    public KeywordSuggester() {
        this(DEFAULT_MAX_DISTANCE);
    }

    /**
     * @param maxDistance The largest edit distance that still produces a suggestion.
     */
    public KeywordSuggester(int maxDistance) {
        if (maxDistance < 0) {
            throw new IllegalArgumentException("Maximum distance must not be negative, got " + maxDistance);
        }
        this.maxDistance = maxDistance;
    }

    /**
     * Builds the text appended to a rejected-keyword error.
     *
     * @param word       The rejected word.
     * @param candidates The keywords valid at the rejecting position.
     * @return The targeted hint for a known mistake, {@code Did you mean 'x'?}, or empty.
     */
    public Optional<String> hintFor(String word, Collection<String> candidates) {
        String mistake = COMMON_MISTAKES.get(word);
        if (mistake != null) {
            return Optional.of(mistake);
        }
        return suggestKeyword(word, candidates, maxDistance).map(keyword -> "Did you mean '" + keyword + "'?");
    }

    /**
     * Finds the candidate closest to {@code word}. Ties go to the earliest candidate.
     *
     * @param word        The misspelled word.
     * @param candidates  The known keywords, in preference order.
     * @param maxDistance The largest accepted edit distance.
     * @return The closest candidate, or empty if none is within {@code maxDistance}.
     */
    public static Optional<String> suggestKeyword(String word, Collection<String> candidates, int maxDistance) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int distance = levenshtein(word, candidate);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return bestDistance <= maxDistance ? Optional.ofNullable(best) : Optional.empty();
    }

    /**
     * Same as {@link #suggestKeyword(String, Collection, int)} with {@link #DEFAULT_MAX_DISTANCE}.
     */
    public static Optional<String> suggestKeyword(String word, Collection<String> candidates) {
        return suggestKeyword(word, candidates, DEFAULT_MAX_DISTANCE);
    }

    /**
     * Computes the edit distance between two strings with unit-cost insertion, deletion and substitution.
     */
    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
