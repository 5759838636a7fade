package com.provider.linkage.similarity;

/**
 * Jaro-Winkler similarity with the usual prefix bonus (up to four characters).
 * Organization names that share a leading word score noticeably higher than with plain Jaro.
 */
public class JaroWinklerSimilarity implements NameSimilarity {

    static final double PREFIX_SCALE = 0.1;
    static final int PREFIX_LIMIT = 4;

    @Override
    public double score(String left, String right) {
        if (left == null || right == null) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        double jaro = jaro(left, right);
        int prefix = commonPrefix(left, right);
        return jaro + prefix * PREFIX_SCALE * (1.0 - jaro);
    }

    @Override
    public String name() {
        return "jaro_winkler";
    }

    private static int commonPrefix(String a, String b) {
        int limit = Math.min(PREFIX_LIMIT, Math.min(a.length(), b.length()));
        int n = 0;
        while (n < limit && a.charAt(n) == b.charAt(n)) {
            n++;
        }
        return n;
    }

    static double jaro(String a, String b) {
        int window = Math.max(0, Math.max(a.length(), b.length()) / 2 - 1);
        boolean[] matchedA = new boolean[a.length()];
        boolean[] matchedB = new boolean[b.length()];

        int matches = 0;
        for (int i = 0; i < a.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(b.length(), i + window + 1);
            for (int j = from; j < to; j++) {
                if (!matchedB[j] && a.charAt(i) == b.charAt(j)) {
                    matchedA[i] = true;
                    matchedB[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int j = 0;
        for (int i = 0; i < a.length(); i++) {
            if (!matchedA[i]) {
                continue;
            }
            while (!matchedB[j]) {
                j++;
            }
            if (a.charAt(i) != b.charAt(j)) {
                halfTranspositions++;
            }
            j++;
        }

        double m = matches;
        double t = halfTranspositions / 2.0;
        return (m / a.length() + m / b.length() + (m - t) / m) / 3.0;
    }
}
