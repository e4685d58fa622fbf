package controlmap.domain.policy;

import controlmap.domain.corpus.PolicyClause;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns a policy document into a clause table.
 */
public interface PolicyPreprocessor {
    /**
     * Extracts the clauses of the document and writes them to the clause table, replacing its contents.
     *
     * @param documentPath A PDF, DOCX or text policy document
     * @return The clauses, numbered from 1
     */
    List<PolicyClause> preprocess(Path documentPath);
}
