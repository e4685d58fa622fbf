package controlmap.domain.retrieval;

import controlmap.domain.corpus.CorpusRecord;
import controlmap.domain.index.ScoredIndex;
import controlmap.domain.index.SimilarityIndex;
import controlmap.domain.vector.Vector;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Retrieves the nearest records and keeps the first, and therefore best scoring, hit for each record id.
 * Several corpus rows can share an id when a control is split into sentences.
 * No similarity threshold is applied here.
 */
@ApplicationScoped
public class CandidateRetrieverImpl implements CandidateRetriever {
    @Override
    public List<MatchCandidate> retrieve(final String queryId,
                                         final Vector queryVector,
                                         final SimilarityIndex index,
                                         final List<CorpusRecord> records,
                                         final int k) {
        final List<MatchCandidate> candidates = new ArrayList<>();
        final Set<String> seenIds = new HashSet<>();

        for (final ScoredIndex hit : index.search(queryVector, k)) {
            // The index and the record list are built separately, so don't trust the position blindly
            if (hit.recordIndex() < 0 || hit.recordIndex() >= records.size()) {
                continue;
            }

            final CorpusRecord record = records.get(hit.recordIndex());
            if (seenIds.add(record.id())) {
                candidates.add(new MatchCandidate(
                        queryId,
                        record.id(),
                        record.body(),
                        record.category(),
                        hit.score(),
                        hit.recordIndex()));
            }
        }

        return candidates;
    }
}
