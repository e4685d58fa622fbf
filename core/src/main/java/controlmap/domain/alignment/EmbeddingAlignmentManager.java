package controlmap.domain.alignment;

import controlmap.domain.corpus.AlignedCorpus;
import controlmap.domain.corpus.CorpusRecord;
import controlmap.domain.corpus.EmbeddingText;

import java.nio.file.Path;
import java.util.List;

/**
 * Pairs a record set with its stored embedding vectors, regenerating the store when it no longer matches.
 */
public interface EmbeddingAlignmentManager {
    /**
     * @param records       The current records
     * @param storePath     The vector store that holds one vector per record
     * @param embeddingText The text of each record that is embedded
     * @return The records and one vector per record
     * @throws controlmap.domain.exceptions.EmbeddingGenerationFailed if the store had to be regenerated and the
     *                                                                embedding model failed
     */
    AlignedCorpus align(List<CorpusRecord> records, Path storePath, EmbeddingText embeddingText);
}
