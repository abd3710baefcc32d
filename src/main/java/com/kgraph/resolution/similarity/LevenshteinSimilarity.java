package com.kgraph.resolution.similarity;

/**
 * Edit-distance ratio: {@code 1 - distance / max(len1, len2)}.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int longest = Math.max(s1.length(), s2.length());
        if (longest == 0 || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        return 1.0 - (double) distance(s1, s2) / longest;
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Number of single-character insertions, deletions and substitutions turning {@code a} into {@code b}.
     * Keeps one row of the edit matrix, sized by the shorter string.
     */
    public static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int[] row = new int[shorter.length() + 1];
        for (int i = 0; i < row.length; i++) {
            row[i] = i;
        }
        for (int j = 1; j <= longer.length(); j++) {
            int diagonal = row[0];
            row[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i < row.length; i++) {
                int above = row[i];
                int substitution = diagonal + (shorter.charAt(i - 1) == c ? 0 : 1);
                row[i] = Math.min(substitution, Math.min(above, row[i - 1]) + 1);
                diagonal = above;
            }
        }
        return row[shorter.length()];
    }
}
