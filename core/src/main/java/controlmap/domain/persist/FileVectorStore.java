package controlmap.domain.persist;

import controlmap.domain.exceptionhandling.ExceptionHandler;
import controlmap.domain.exceptions.VectorStoreFailure;
import controlmap.domain.vector.Vector;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Saves vectors as a binary matrix: the row count, the dimension, then every component as a big-endian
 * float, row by row.
 * <p>
 * Writes go to a temporary file in the target directory which is then moved over the target. If anything
 * fails the old store is left untouched. Two processes regenerating the same store at the same time are not
 * coordinated: the last move wins.
 */
@ApplicationScoped
public class FileVectorStore implements VectorStore {
    @Inject
    private Logger logger;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Override
    public Optional<Integer> rowCount(final Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }

        return Optional.of(Try.withResources(() -> new DataInputStream(new BufferedInputStream(Files.newInputStream(path))))
                .of(DataInputStream::readInt)
                .getOrElseThrow(ex -> new VectorStoreFailure("Failed to read the header of vector store " + path, ex)));
    }

    @Override
    public List<Vector> read(final Path path) {
        return Try.withResources(() -> new TimedOperation("Read vector store " + path.getFileName()))
                .of(t -> Try.withResources(() -> new DataInputStream(new BufferedInputStream(Files.newInputStream(path))))
                        .of(this::readVectors)
                        .get())
                .getOrElseThrow(ex -> new VectorStoreFailure("Failed to read vector store " + path, ex));
    }

    private List<Vector> readVectors(final DataInputStream input) throws IOException {
        final int rows = input.readInt();
        final int dimension = input.readInt();

        if (rows < 0 || dimension < 0) {
            throw new IOException("Invalid vector store header: rows=" + rows + ", dimension=" + dimension);
        }

        final List<Vector> vectors = new ArrayList<>(rows);
        for (int row = 0; row < rows; row++) {
            final float[] values = new float[dimension];
            for (int i = 0; i < dimension; i++) {
                values[i] = input.readFloat();
            }
            vectors.add(new Vector(values));
        }

        return vectors;
    }

    @Override
    public void write(final Path path, final List<Vector> vectors) {
        final int dimension = vectors.isEmpty() ? 0 : vectors.get(0).dimension();
        if (vectors.stream().anyMatch(vector -> vector.dimension() != dimension)) {
            throw new VectorStoreFailure("All vectors in a store must have the same dimension");
        }

        final Path target = path.toAbsolutePath();

        Try.of(() -> Files.createDirectories(target.getParent()))
                .mapTry(directory -> Files.createTempFile(directory, target.getFileName().toString(), ".tmp"))
                .andThenTry(temp -> writeVectors(temp, vectors, dimension))
                .andThenTry(temp -> move(temp, target))
                .onFailure(ex -> logger.warning("Failed to write vector store " + target + ": " + exceptionHandler.getExceptionMessage(ex)))
                .getOrElseThrow(ex -> new VectorStoreFailure("Failed to write vector store " + target, ex));

        logger.info("Saved " + vectors.size() + " vectors of dimension " + dimension + " to " + target);
    }

    private void writeVectors(final Path temp, final List<Vector> vectors, final int dimension) throws IOException {
        try (DataOutputStream output = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
            output.writeInt(vectors.size());
            output.writeInt(dimension);
            for (final Vector vector : vectors) {
                for (final float value : vector.value()) {
                    output.writeFloat(value);
                }
            }
        } catch (final IOException ex) {
            Files.deleteIfExists(temp);
            throw ex;
        }
    }

    private void move(final Path temp, final Path target) throws IOException {
        try {
            moveReplacing(temp, target);
        } catch (final IOException ex) {
            Files.deleteIfExists(temp);
            throw ex;
        }
    }

    private void moveReplacing(final Path temp, final Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException ex) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
