package controlmap.domain.clause;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Splits policy text on sentence ends, list markers and paragraph breaks. Pieces of 20 characters or less
 * are usually headings or list numbers and are dropped.
 */
@ApplicationScoped
public class SimpleClauseSplitter implements ClauseSplitter {
    private static final int MIN_CLAUSE_LENGTH = 20;

    private static final Pattern CLAUSE_BOUNDARY = Pattern.compile(String.join("|",
            // a sentence end followed by the capital letter of the next sentence
            "(?<=[.!?])\\s+(?=[A-Z])",
            // numbered clauses such as "1." or "2.1" at the start of a line
            "(?<=\\n)\\s*\\d+(?:\\.\\d+)*\\.?\\s+",
            // lettered sub clauses such as "a." at the start of a line
            "(?<=\\n)\\s*[a-zA-Z]\\.\\s+",
            // paragraphs
            "\\n{2,}",
            "•\\s*",
            // dash bullets, but not hyphenated words
            "(?<!\\w)-\\s*"));

    @Override
    public List<String> split(final String document) {
        if (StringUtils.isBlank(document)) {
            return List.of();
        }

        return Stream.of(CLAUSE_BOUNDARY.split(document.replace("\r\n", "\n")))
                .map(String::strip)
                .filter(clause -> clause.length() > MIN_CLAUSE_LENGTH)
                .toList();
    }
}
