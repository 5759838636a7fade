package com.provider.linkage.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameSimilarityTest {

    private static final double DELTA = 1e-4;

    @Nested
    @DisplayName("Levenshtein")
    class Levenshtein {
        private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

        @Test
        @DisplayName("Should compute edit distance")
        void testDistance() {
            assertEquals(3, LevenshteinSimilarity.distance("kitten", "sitting"));
            assertEquals(0, LevenshteinSimilarity.distance("", ""));
            assertEquals(4, LevenshteinSimilarity.distance("", "abcd"));
        }

        @Test
        @DisplayName("Should normalize by the longer length")
        void testScore() {
            assertEquals(1.0 - 3.0 / 7.0, similarity.score("kitten", "sitting"), DELTA);
            assertEquals(1.0, similarity.score("clinic", "clinic"));
            assertEquals(0.0, similarity.score("", "clinic"));
            assertEquals(0.0, similarity.score(null, "clinic"));
        }
    }

    @Nested
    @DisplayName("Jaro-Winkler")
    class JaroWinkler {
        private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();

        @Test
        @DisplayName("Should match reference values")
        void testReferenceValues() {
            assertEquals(0.9444, JaroWinklerSimilarity.jaro("martha", "marhta"), DELTA);
            assertEquals(0.9611, similarity.score("martha", "marhta"), DELTA);
            assertEquals(0.8133, similarity.score("dixon", "dicksonx"), DELTA);
        }

        @Test
        @DisplayName("Disjoint strings should score zero")
        void testDisjoint() {
            assertEquals(0.0, similarity.score("abc", "xyz"));
            assertEquals(0.0, similarity.score("", "xyz"));
        }
    }

    @Nested
    @DisplayName("Token Jaccard")
    class TokenJaccard {
        private final TokenJaccardSimilarity similarity = new TokenJaccardSimilarity();

        @Test
        @DisplayName("Should ignore token order")
        void testOrderInsensitive() {
            assertEquals(1.0, similarity.score("family health sunrise", "sunrise family health"));
            assertEquals(0.5, similarity.score("sunrise health center", "sunrise clinic center"), DELTA);
        }
    }

    @Nested
    @DisplayName("Composite")
    class Composite {

        @Test
        @DisplayName("Should blend components with the configured weights")
        void testBlend() {
            CompositeNameSimilarity composite = new CompositeNameSimilarity();
            String a = "sunrise family helth center";
            String b = "sunrise family health center";
            double expected = 0.40 * new LevenshteinSimilarity().score(a, b)
                    + 0.45 * new JaroWinklerSimilarity().score(a, b)
                    + 0.15 * new TokenJaccardSimilarity().score(a, b);

            assertEquals(expected, composite.score(a, b), 1e-12);
            assertTrue(composite.score(a, b) > 0.88);
        }

        @Test
        @DisplayName("Should be symmetric and bounded")
        void testSymmetry() {
            CompositeNameSimilarity composite = new CompositeNameSimilarity();
            double forward = composite.score("north clinic", "northside medical group");
            double backward = composite.score("northside medical group", "north clinic");

            assertEquals(forward, backward, 1e-12);
            assertTrue(forward >= 0.0 && forward <= 1.0);
            assertEquals(1.0, composite.score("same", "same"));
        }

        @Test
        @DisplayName("Weights must sum to one")
        void testWeightValidation() {
            assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(0.5, 0.5, 0.5));
            assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(-0.1, 0.6, 0.5));
            assertDoesNotThrow(() -> new SimilarityWeights(1.0, 0.0, 0.0));
        }
    }
}
