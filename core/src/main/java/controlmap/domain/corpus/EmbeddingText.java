package controlmap.domain.corpus;

import org.apache.commons.lang3.StringUtils;

/**
 * Selects the text of a record that is passed to the embedding model.
 */
public enum EmbeddingText {
    /**
     * Embed the body only. Used for control sentences and policy clauses.
     */
    BODY {
        @Override
        public String of(final CorpusRecord record) {
            return record.body();
        }
    },
    /**
     * Embed the title followed by the body. Used for requirements, where the artifact name carries
     * as much meaning as the description.
     */
    TITLE_AND_BODY {
        @Override
        public String of(final CorpusRecord record) {
            return (StringUtils.defaultString(record.title()) + " " + record.body()).strip();
        }
    };

    public abstract String of(CorpusRecord record);
}
