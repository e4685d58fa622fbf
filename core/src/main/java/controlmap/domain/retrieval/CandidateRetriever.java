package controlmap.domain.retrieval;

import controlmap.domain.corpus.CorpusRecord;
import controlmap.domain.index.SimilarityIndex;
import controlmap.domain.vector.Vector;

import java.util.List;

/**
 * Finds the corpus records closest to a query.
 */
public interface CandidateRetriever {
    int DEFAULT_TOP_K = 50;

    /**
     * @param queryId     The id copied into every candidate
     * @param queryVector The embedding of the query
     * @param index       The index built from the vectors of the records
     * @param records     The records, in the same order as the vectors in the index
     * @param k           The number of nearest neighbours to request from the index
     * @return Candidates ordered by descending score, with at most one candidate per record id
     */
    List<MatchCandidate> retrieve(String queryId, Vector queryVector, SimilarityIndex index, List<CorpusRecord> records, int k);

    default List<MatchCandidate> retrieve(final String queryId, final Vector queryVector, final SimilarityIndex index, final List<CorpusRecord> records) {
        return retrieve(queryId, queryVector, index, records, DEFAULT_TOP_K);
    }
}
