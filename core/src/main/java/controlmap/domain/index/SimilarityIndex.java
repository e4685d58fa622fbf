package controlmap.domain.index;

import controlmap.domain.exceptions.InternalFailure;
import controlmap.domain.vector.Vector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * An exact nearest neighbour index. Every vector is L2 normalized when the index is built, and every
 * query is normalized before it is scored, so the inner product is the cosine similarity.
 * <p>
 * The index is immutable. A new index is built whenever the corpus changes.
 */
public class SimilarityIndex {
    /**
     * Orders hits from best to worst. Equal scores keep the corpus order.
     */
    private static final Comparator<ScoredIndex> BEST_FIRST = Comparator
            .comparingDouble(ScoredIndex::score).reversed()
            .thenComparingInt(ScoredIndex::recordIndex);

    private final float[][] vectors;
    private final int dimension;

    public SimilarityIndex(final List<Vector> corpus) {
        this.dimension = corpus.isEmpty() ? 0 : corpus.get(0).dimension();
        this.vectors = new float[corpus.size()][];

        for (int i = 0; i < corpus.size(); i++) {
            final Vector vector = corpus.get(i);
            if (vector.dimension() != dimension) {
                throw new InternalFailure("Vector " + i + " has dimension " + vector.dimension() + " but the index has dimension " + dimension);
            }
            vectors[i] = vector.normalize().value();
        }
    }

    public int size() {
        return vectors.length;
    }

    public int dimension() {
        return dimension;
    }

    /**
     * Scores every vector in the index against the query.
     *
     * @param query The query vector. It does not need to be normalized.
     * @param k     The maximum number of hits to return
     * @return Up to k hits ordered by descending score, with ties broken by corpus order
     */
    public List<ScoredIndex> search(final Vector query, final int k) {
        final int limit = Math.min(k, vectors.length);
        if (limit <= 0) {
            return List.of();
        }

        if (query.dimension() != dimension) {
            throw new InternalFailure("Query has dimension " + query.dimension() + " but the index has dimension " + dimension);
        }

        final float[] normalizedQuery = query.normalize().value();

        // The head of the queue is the worst of the hits kept so far
        final PriorityQueue<ScoredIndex> best = new PriorityQueue<>(limit + 1, BEST_FIRST.reversed());

        for (int i = 0; i < vectors.length; i++) {
            best.offer(new ScoredIndex(i, innerProduct(vectors[i], normalizedQuery)));

            if (best.size() > limit) {
                best.poll();
            }
        }

        final List<ScoredIndex> hits = new ArrayList<>(best);
        hits.sort(BEST_FIRST);
        return hits;
    }

    private static double innerProduct(final float[] a, final float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }
}
