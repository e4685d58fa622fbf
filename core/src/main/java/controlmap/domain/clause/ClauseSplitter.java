package controlmap.domain.clause;

import java.util.List;

/**
 * Splits a policy document into clauses.
 */
public interface ClauseSplitter {
    List<String> split(String document);
}
