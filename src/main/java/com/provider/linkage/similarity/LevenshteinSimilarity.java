package com.provider.linkage.similarity;

/**
 * Edit-distance similarity: {@code 1 - distance / max(len)}.
 */
public class LevenshteinSimilarity implements NameSimilarity {

    @Override
    public double score(String left, String right) {
        if (left == null || right == null) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        int longest = Math.max(left.length(), right.length());
        if (longest == 0 || left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        return 1.0 - (double) distance(left, right) / longest;
    }

    @Override
    public String name() {
        return "levenshtein";
    }

    /**
     * Wagner-Fischer distance keeping two rows sized by the shorter input.
     */
    static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;

        int[] prev = new int[shorter.length() + 1];
        int[] curr = new int[shorter.length() + 1];
        for (int i = 0; i < prev.length; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            curr[0] = j;
            char lc = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = prev[i - 1] + (shorter.charAt(i - 1) == lc ? 0 : 1);
                curr[i] = Math.min(substitution, Math.min(prev[i] + 1, curr[i - 1] + 1));
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[shorter.length()];
    }
}
