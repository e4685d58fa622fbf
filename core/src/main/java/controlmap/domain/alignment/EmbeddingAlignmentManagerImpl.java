package controlmap.domain.alignment;

import com.google.common.collect.Lists;
import controlmap.domain.config.EmbeddingConfig;
import controlmap.domain.corpus.AlignedCorpus;
import controlmap.domain.corpus.CorpusRecord;
import controlmap.domain.corpus.EmbeddingText;
import controlmap.domain.embedding.EmbeddingModel;
import controlmap.domain.exceptionhandling.ExceptionHandler;
import controlmap.domain.exceptions.EmbeddingGenerationFailed;
import controlmap.domain.persist.TimedOperation;
import controlmap.domain.persist.VectorStore;
import controlmap.domain.vector.Vector;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * A store is trusted when it holds exactly one vector per record. Its contents are not compared with the
 * record texts, so edits that keep the row count unchanged require the store to be deleted.
 * <p>
 * Regeneration always embeds the whole record set and replaces the store in one write.
 */
@ApplicationScoped
public class EmbeddingAlignmentManagerImpl implements EmbeddingAlignmentManager {
    @Inject
    private VectorStore vectorStore;

    @Inject
    private EmbeddingModel embeddingModel;

    @Inject
    private EmbeddingConfig embeddingConfig;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    @Override
    public AlignedCorpus align(final List<CorpusRecord> records, final Path storePath, final EmbeddingText embeddingText) {
        if (records.isEmpty()) {
            return new AlignedCorpus(List.of(), List.of());
        }

        final Optional<List<Vector>> stored = readMatchingStore(records.size(), storePath);
        if (stored.isPresent()) {
            logger.info("Loaded " + records.size() + " aligned vectors from " + storePath);
            return new AlignedCorpus(records, stored.get());
        }

        final List<Vector> vectors = regenerate(records, embeddingText);
        vectorStore.write(storePath, vectors);
        return new AlignedCorpus(records, vectors);
    }

    private Optional<List<Vector>> readMatchingStore(final int recordCount, final Path storePath) {
        return Try.of(() -> vectorStore.rowCount(storePath))
                .onFailure(ex -> logger.warning("Vector store " + storePath + " is unreadable and will be regenerated: "
                        + exceptionHandler.getExceptionMessage(ex)))
                .getOrElse(Optional.empty())
                .filter(rows -> {
                    if (rows != recordCount) {
                        logger.warning("Vector store " + storePath + " has " + rows + " vectors but there are "
                                + recordCount + " records. Regenerating embeddings.");
                        return false;
                    }
                    return true;
                })
                .flatMap(rows -> Try.of(() -> vectorStore.read(storePath))
                        .onFailure(ex -> logger.warning("Vector store " + storePath + " is unreadable and will be regenerated: "
                                + exceptionHandler.getExceptionMessage(ex)))
                        .toJavaOptional())
                .filter(vectors -> vectors.size() == recordCount);
    }

    private List<Vector> regenerate(final List<CorpusRecord> records, final EmbeddingText embeddingText) {
        final List<String> texts = records.stream().map(embeddingText::of).toList();
        final List<Vector> vectors = new ArrayList<>(texts.size());

        try (TimedOperation ignored = new TimedOperation("Embed " + texts.size() + " records")) {
            for (final List<String> batch : Lists.partition(texts, embeddingConfig.getBatchSize())) {
                final List<Vector> embedded = embeddingModel.embed(batch);
                if (embedded.size() != batch.size()) {
                    throw new EmbeddingGenerationFailed("Embedding model returned " + embedded.size()
                            + " vectors for " + batch.size() + " texts");
                }
                vectors.addAll(embedded);
                logger.fine("Embedded " + vectors.size() + "/" + texts.size() + " records");
            }
        }

        return vectors;
    }
}
