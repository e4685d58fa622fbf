package controlmap.domain.merge;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RatcliffObershelpSimilarityTest {

    private final TextSimilarity similarity = new RatcliffObershelpSimilarity();

    @Test
    void testIdenticalAndEmpty() {
        assertEquals(1.0, similarity.ratio("log access events", "log access events"), 1e-12);
        assertEquals(1.0, similarity.ratio("", ""), 1e-12);
        assertEquals(0.0, similarity.ratio("", "abc"), 1e-12);
    }

    @Test
    void testRatio() {
        assertEquals(0.75, similarity.ratio("abcd", "bcde"), 1e-12);
        assertEquals(0.7936507936507936, similarity.ratio("perform quarterly access review", "conduct quarterly access reviews"), 1e-12);
        assertEquals(0.8860759493670886, similarity.ratio(
                "Access to systems is reviewed quarterly.",
                "Access to systems is reviewed annually."), 1e-12);
    }

    @Test
    void testOrderMatters() {
        assertEquals(0.25, similarity.ratio("tide", "diet"), 1e-12);
        assertEquals(0.5, similarity.ratio("diet", "tide"), 1e-12);
    }

    @Test
    void testPopularCharactersAreIgnoredInLongText() {
        // every character of the second text repeats more than 1% of its 300 characters
        final String repeated = "ab".repeat(150);

        assertEquals(0.0, similarity.ratio("x" + repeated, repeated), 1e-12);
        assertEquals(0.0, similarity.ratio("ba".repeat(150), repeated), 1e-12);
        // the same text is still matched in full by growing the empty block over equal neighbours
        assertEquals(1.0, similarity.ratio(repeated, repeated), 1e-12);
    }

    @Test
    void testComparesCodePoints() {
        assertEquals(0.75, similarity.ratio("😀abc", "😀abd"), 1e-12);
        assertEquals(0.75, similarity.ratio("Café déjà vu", "Cafe deja vu"), 1e-12);
    }
}
