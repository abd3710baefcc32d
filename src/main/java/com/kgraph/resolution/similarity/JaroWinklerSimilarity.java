package com.kgraph.resolution.similarity;

/**
 * Jaro-Winkler similarity: Jaro similarity boosted by the length of the common prefix
 * (at most four characters), which favors names that start the same way.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_PREFIX_SCALE = 0.1;
    private static final int MAX_PREFIX = 4;

    private final double prefixScale;

    public JaroWinklerSimilarity() {
        this(DEFAULT_PREFIX_SCALE);
    }

    public JaroWinklerSimilarity(double prefixScale) {
        if (prefixScale < 0 || prefixScale > 0.25) {
            throw new IllegalArgumentException("prefixScale must be between 0 and 0.25, got " + prefixScale);
        }
        this.prefixScale = prefixScale;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        double jaro = jaro(s1, s2);
        int prefix = commonPrefix(s1, s2, MAX_PREFIX);
        return jaro + prefix * prefixScale * (1.0 - jaro);
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    static double jaro(String s1, String s2) {
        int window = Math.max(0, Math.max(s1.length(), s2.length()) / 2 - 1);
        boolean[] taken = new boolean[s2.length()];
        char[] matched1 = new char[s1.length()];
        int matches = 0;

        for (int i = 0; i < s1.length(); i++) {
            char c = s1.charAt(i);
            int from = Math.max(0, i - window);
            int to = Math.min(s2.length() - 1, i + window);
            for (int j = from; j <= to; j++) {
                if (!taken[j] && s2.charAt(j) == c) {
                    taken[j] = true;
                    matched1[matches++] = c;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int k = 0;
        for (int j = 0; j < s2.length(); j++) {
            if (taken[j]) {
                if (s2.charAt(j) != matched1[k]) {
                    halfTranspositions++;
                }
                k++;
            }
        }

        double m = matches;
        return (m / s1.length() + m / s2.length() + (m - halfTranspositions / 2.0) / m) / 3.0;
    }

    private static int commonPrefix(String s1, String s2, int limit) {
        int max = Math.min(limit, Math.min(s1.length(), s2.length()));
        int n = 0;
        while (n < max && s1.charAt(n) == s2.charAt(n)) {
            n++;
        }
        return n;
    }
}
