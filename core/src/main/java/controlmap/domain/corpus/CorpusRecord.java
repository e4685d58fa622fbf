package controlmap.domain.corpus;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * One entry of a reference corpus: a control (or control sentence) or an evidence requirement.
 *
 * @param id         The stable identifier of the record, e.g. a control id or a requirement id
 * @param category   The domain of a control, or the area of focus of a requirement
 * @param title      The control title or artifact name
 * @param body       The text that is matched against
 * @param foreignKey The id of a related record, e.g. the control a requirement is linked to
 */
public record CorpusRecord(String id,
                           String category,
                           @Nullable String title,
                           String body,
                           @Nullable String foreignKey) {
    public CorpusRecord {
        Objects.requireNonNull(id);
        Objects.requireNonNull(category);
        Objects.requireNonNull(body);
    }

    public CorpusRecord(final String id, final String category, final String body) {
        this(id, category, null, body, null);
    }
}
