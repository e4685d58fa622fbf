package controlmap.domain.mapping.impl;

import controlmap.domain.alignment.EmbeddingAlignmentManager;
import controlmap.domain.config.DataPaths;
import controlmap.domain.config.MappingConfig;
import controlmap.domain.corpus.AlignedCorpus;
import controlmap.domain.corpus.EmbeddingText;
import controlmap.domain.corpus.PolicyClause;
import controlmap.domain.exceptions.InternalFailure;
import controlmap.domain.index.SimilarityIndex;
import controlmap.domain.json.JsonDeserializer;
import controlmap.domain.mapping.ClauseMappingPipeline;
import controlmap.domain.mapping.MappingExplanation;
import controlmap.domain.mapping.MappingResult;
import controlmap.domain.merge.MergeEngine;
import controlmap.domain.merge.MergeResult;
import controlmap.domain.persist.TimedOperation;
import controlmap.domain.retrieval.CandidateRetriever;
import controlmap.domain.retrieval.MatchCandidate;
import controlmap.domain.tables.CorpusTables;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.IntStream;

/**
 * Loads the controls and the clauses, makes sure both have one vector per row, and maps each clause in turn.
 * Any failure stops the whole run.
 */
@ApplicationScoped
public class ClauseMappingPipelineImpl implements ClauseMappingPipeline {
    @Inject
    private DataPaths dataPaths;

    @Inject
    private MappingConfig mappingConfig;

    @Inject
    private CorpusTables corpusTables;

    @Inject
    private EmbeddingAlignmentManager alignmentManager;

    @Inject
    private CandidateRetriever candidateRetriever;

    @Inject
    private MergeEngine mergeEngine;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private Logger logger;

    @Override
    public List<MappingResult> run() {
        final AlignedCorpus controls = alignmentManager.align(
                corpusTables.readControls(dataPaths.getControls()),
                dataPaths.getControlVectors(),
                EmbeddingText.BODY);
        logger.info("Loaded " + controls.size() + " controls");

        final List<PolicyClause> allClauses = corpusTables.readClauses(dataPaths.getClauses());
        final List<PolicyClause> clauses = distinctByText(allClauses);
        logger.info("Clauses before deduplication: " + allClauses.size() + ", after: " + clauses.size());

        final AlignedCorpus clauseCorpus = alignmentManager.align(
                clauses.stream().map(PolicyClause::toCorpusRecord).toList(),
                dataPaths.getClauseVectors(),
                EmbeddingText.BODY);

        final SimilarityIndex index = new SimilarityIndex(controls.vectors());
        final List<MappingResult> results = new ArrayList<>(clauses.size());

        try (TimedOperation ignored = new TimedOperation("Map " + clauses.size() + " clauses")) {
            for (int i = 0; i < clauses.size(); i++) {
                final PolicyClause clause = clauses.get(i);

                final List<MatchCandidate> candidates = candidateRetriever.retrieve(
                        clause.policyId(),
                        clauseCorpus.vectors().get(i),
                        index,
                        controls.records(),
                        mappingConfig.getTopK());

                logger.info("Mapping clause " + (i + 1) + "/" + clauses.size() + ", found " + candidates.size() + " candidate matches");

                final MergeResult merged = mergeEngine.merge(candidates, mappingConfig.getThreshold());

                results.add(new MappingResult(
                        clause.policyId(),
                        clause.clauseIndex(),
                        clause.text(),
                        merged.matches().stream().map(MappingExplanation::fromMatch).toList()));
            }
        }

        write(dataPaths.getMappings(), results);
        return results;
    }

    /**
     * Keeps the first clause with any given text. The remaining clauses are renumbered from 0.
     */
    private List<PolicyClause> distinctByText(final List<PolicyClause> clauses) {
        final Set<String> seen = new HashSet<>();
        final List<PolicyClause> distinct = clauses.stream()
                .filter(clause -> seen.add(clause.text()))
                .toList();

        return IntStream.range(0, distinct.size())
                .mapToObj(i -> new PolicyClause(distinct.get(i).policyId(), i, distinct.get(i).text()))
                .toList();
    }

    private void write(final Path path, final List<MappingResult> results) {
        Try.run(() -> {
                    if (path.toAbsolutePath().getParent() != null) {
                        Files.createDirectories(path.toAbsolutePath().getParent());
                    }
                    Files.writeString(path, jsonDeserializer.serialize(results), StandardCharsets.UTF_8);
                })
                .getOrElseThrow(ex -> new InternalFailure("Failed to write mapping results to " + path, ex));

        logger.info("Saved " + results.size() + " mapping results to " + path);
    }
}
