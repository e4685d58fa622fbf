package controlmap.domain.index;

/**
 * A search hit: the position of a corpus vector and its similarity to the query.
 *
 * @param recordIndex The position of the vector in the indexed corpus
 * @param score       The cosine similarity to the query
 */
public record ScoredIndex(int recordIndex, double score) {
}
