package controlmap.domain.persist;

import controlmap.domain.vector.Vector;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Stores the embedding vectors of a corpus. A store is always read and written as a whole.
 */
public interface VectorStore {
    /**
     * @return The number of vectors in the store, or empty if the store does not exist
     */
    Optional<Integer> rowCount(Path path);

    /**
     * @return All vectors in the store, in the order they were written
     */
    List<Vector> read(Path path);

    /**
     * Replaces the store with the supplied vectors. Readers never see a partially written store.
     */
    void write(Path path, List<Vector> vectors);
}
