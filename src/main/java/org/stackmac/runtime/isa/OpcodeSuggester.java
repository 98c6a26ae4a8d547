package org.stackmac.runtime.isa;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds known opcode names that are spelled similarly to an unknown one.
 * <p>
 * Similarity is the Ratcliff/Obershelp ratio {@code 2*M / (|a| + |b|)}, where M is the number of
 * characters in matching blocks found by recursively taking the longest common substring.
 */
public final class OpcodeSuggester {

    private OpcodeSuggester() {}

    /**
     * Returns up to {@code limit} candidates whose similarity to {@code word} is at least
     * {@code threshold}, best match first. Ties are ordered by name.
     *
     * @param word The unknown name.
     * @param candidates The known names.
     * @param limit Maximum number of results.
     * @param threshold Minimum similarity ratio in {@code [0, 1]}.
     * @return The matching names.
     */
    public static List<String> suggest(String word, Iterable<String> candidates, int limit, double threshold) {
        record Scored(String name, double score) {}
        List<Scored> scored = new ArrayList<>();
        for (String candidate : candidates) {
            double score = similarity(word, candidate);
            if (score >= threshold) {
                scored.add(new Scored(candidate, score));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed().thenComparing(Scored::name));
        List<String> result = new ArrayList<>();
        for (int i = 0; i < scored.size() && i < limit; i++) {
            result.add(scored.get(i).name());
        }
        return result;
    }

    /**
     * Computes the similarity ratio of two strings.
     * @param a The first string.
     * @param b The second string.
     * @return A value in {@code [0, 1]}; 1 means equal.
     */
    public static double similarity(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
    }

    private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        int bestLen = 0;
        int bestA = aLo;
        int bestB = bLo;
        for (int i = aLo; i < aHi; i++) {
            for (int j = bLo; j < bHi; j++) {
                int k = 0;
                while (i + k < aHi && j + k < bHi && a.charAt(i + k) == b.charAt(j + k)) {
                    k++;
                }
                if (k > bestLen) {
                    bestLen = k;
                    bestA = i;
                    bestB = j;
                }
            }
        }
        if (bestLen == 0) {
            return 0;
        }
        return bestLen
                + matchingCharacters(a, aLo, bestA, b, bLo, bestB)
                + matchingCharacters(a, bestA + bestLen, aHi, b, bestB + bestLen, bHi);
    }
}
