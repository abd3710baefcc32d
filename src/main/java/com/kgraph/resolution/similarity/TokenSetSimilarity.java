package com.kgraph.resolution.similarity;

import java.util.Arrays;

/**
 * Soft Jaccard overlap of whitespace tokens.
 *
 * <p>Each token of the first string is paired with its best unused token of the second:
 * equal tokens count 1.0; a token that is a prefix of the other, at least
 * {@value #MIN_PREFIX} characters long, counts {@value #PREFIX_CREDIT} ("tim" and "timothy").
 * The score is {@code overlap / (|A| + |B| - overlap)}.</p>
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    static final int MIN_PREFIX = 3;
    static final double PREFIX_CREDIT = 0.9;

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        String[] a = tokens(s1);
        String[] b = tokens(s2);
        if (a.length == 0 || b.length == 0) {
            return 0.0;
        }

        boolean[] used = new boolean[b.length];
        double overlap = 0.0;
        for (String token : a) {
            int bestIndex = -1;
            double bestCredit = 0.0;
            for (int j = 0; j < b.length; j++) {
                if (used[j]) {
                    continue;
                }
                double credit = credit(token, b[j]);
                if (credit > bestCredit) {
                    bestCredit = credit;
                    bestIndex = j;
                    if (credit == 1.0) {
                        break;
                    }
                }
            }
            if (bestIndex >= 0) {
                used[bestIndex] = true;
                overlap += bestCredit;
            }
        }
        return overlap / (a.length + b.length - overlap);
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    private static double credit(String x, String y) {
        if (x.equals(y)) {
            return 1.0;
        }
        String shorter = x.length() < y.length() ? x : y;
        String longer = shorter == x ? y : x;
        if (shorter.length() >= MIN_PREFIX && longer.startsWith(shorter)) {
            return PREFIX_CREDIT;
        }
        return 0.0;
    }

    private static String[] tokens(String s) {
        String trimmed = s.trim();
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return Arrays.stream(trimmed.split("\\s+")).distinct().toArray(String[]::new);
    }
}
