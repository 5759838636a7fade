package com.provider.linkage.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard index over whitespace-separated tokens.
 */
public class TokenJaccardSimilarity implements NameSimilarity {

    @Override
    public double score(String left, String right) {
        if (left == null || right == null) {
            return 0.0;
        }
        Set<String> a = tokens(left);
        Set<String> b = tokens(right);
        if (a.isEmpty() && b.isEmpty()) {
            return left.equals(right) ? 1.0 : 0.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        a.retainAll(b);
        return (double) a.size() / union.size();
    }

    @Override
    public String name() {
        return "token_jaccard";
    }

    private static Set<String> tokens(String value) {
        Set<String> out = new HashSet<>();
        for (String token : value.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                out.add(token);
            }
        }
        return out;
    }
}
