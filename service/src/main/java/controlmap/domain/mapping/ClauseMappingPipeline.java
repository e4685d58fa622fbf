package controlmap.domain.mapping;

import java.util.List;

/**
 * Maps every clause of the clause table to the controls it most likely implements.
 */
public interface ClauseMappingPipeline {
    /**
     * Maps the clauses and writes the results to the mapping results file.
     *
     * @return One result per distinct clause, in table order
     */
    List<MappingResult> run();
}
