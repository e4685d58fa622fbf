package controlmap.domain.merge;

/**
 * Measures how similar two strings are.
 */
public interface TextSimilarity {
    /**
     * @return A ratio between 0 (nothing in common) and 1 (identical)
     */
    double ratio(String a, String b);
}
