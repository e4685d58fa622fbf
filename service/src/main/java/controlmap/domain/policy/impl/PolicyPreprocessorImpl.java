package controlmap.domain.policy.impl;

import controlmap.domain.clause.ClauseSplitter;
import controlmap.domain.config.DataPaths;
import controlmap.domain.converter.FileToText;
import controlmap.domain.corpus.PolicyClause;
import controlmap.domain.policy.PolicyPreprocessor;
import controlmap.domain.tables.CorpusTables;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.io.FilenameUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * The policy id of every clause is the document file name without its extension.
 */
@ApplicationScoped
public class PolicyPreprocessorImpl implements PolicyPreprocessor {
    @Inject
    private FileToText fileToText;

    @Inject
    private ClauseSplitter clauseSplitter;

    @Inject
    private CorpusTables corpusTables;

    @Inject
    private DataPaths dataPaths;

    @Inject
    private Logger logger;

    @Override
    public List<PolicyClause> preprocess(final Path documentPath) {
        final String policyId = FilenameUtils.getBaseName(documentPath.getFileName().toString());
        final List<String> texts = clauseSplitter.split(fileToText.convert(documentPath));

        final List<PolicyClause> clauses = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            clauses.add(new PolicyClause(policyId, i + 1, texts.get(i)));
        }

        corpusTables.writeClauses(dataPaths.getClauses(), clauses);
        logger.info("Processed " + clauses.size() + " clauses from " + documentPath + " into " + dataPaths.getClauses());

        return clauses;
    }
}
