package controlmap.domain.corpus;

import controlmap.domain.exceptions.AlignmentMismatch;
import controlmap.domain.vector.Vector;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * A record set and its embedding vectors, aligned by position. The vector at index i is the embedding
 * of the record at index i.
 *
 * @param records The corpus records
 * @param vectors The embedding vectors, one per record
 */
public record AlignedCorpus(List<CorpusRecord> records, List<Vector> vectors) {
    public AlignedCorpus {
        records = List.copyOf(records);
        vectors = List.copyOf(vectors);

        if (records.size() != vectors.size()) {
            throw new AlignmentMismatch("Corpus has " + records.size() + " records but " + vectors.size() + " vectors");
        }
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Returns the records matching the predicate along with their vectors, keeping the original order.
     */
    public AlignedCorpus subset(final Predicate<CorpusRecord> predicate) {
        final List<CorpusRecord> subsetRecords = new ArrayList<>();
        final List<Vector> subsetVectors = new ArrayList<>();

        for (int i = 0; i < records.size(); i++) {
            if (predicate.test(records.get(i))) {
                subsetRecords.add(records.get(i));
                subsetVectors.add(vectors.get(i));
            }
        }

        return new AlignedCorpus(subsetRecords, subsetVectors);
    }
}
