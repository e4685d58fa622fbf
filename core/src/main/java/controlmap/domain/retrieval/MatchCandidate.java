package controlmap.domain.retrieval;

/**
 * A corpus record returned by the nearest neighbour search for one query.
 *
 * @param queryId         The id of the clause or evidence that was searched for
 * @param matchedId       The id of the matched corpus record
 * @param matchedText     The text of the matched corpus record
 * @param matchedCategory The domain or area of focus of the matched corpus record
 * @param score           The cosine similarity between the query and the matched record
 * @param recordIndex     The position of the matched record in the searched record list
 */
public record MatchCandidate(String queryId,
                             String matchedId,
                             String matchedText,
                             String matchedCategory,
                             double score,
                             int recordIndex) {
}
