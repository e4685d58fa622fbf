package controlmap.domain.evidence;

import controlmap.domain.confidence.ConfidenceClassifier;
import controlmap.domain.confidence.ScoreFormat;
import controlmap.domain.config.EvidenceConfig;
import controlmap.domain.corpus.AlignedCorpus;
import controlmap.domain.corpus.CorpusRecord;
import controlmap.domain.embedding.EmbeddingModel;
import controlmap.domain.index.SimilarityIndex;
import controlmap.domain.retrieval.CandidateRetriever;
import controlmap.domain.retrieval.MatchCandidate;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Compares evidence with the requirements linked to the target control. When no requirement is linked to
 * the control, the whole requirement corpus is searched instead and every explanation says so.
 * <p>
 * The index is built per call from the scoped requirements, so nothing is shared between validations.
 */
@ApplicationScoped
public class ScopedEvidenceValidator implements EvidenceValidator {
    private static final int DESCRIPTION_PREVIEW_LENGTH = 200;

    @Inject
    private EmbeddingModel embeddingModel;

    @Inject
    private CandidateRetriever candidateRetriever;

    @Inject
    private ConfidenceClassifier confidenceClassifier;

    @Inject
    private EvidenceConfig evidenceConfig;

    @Inject
    private Logger logger;

    @Override
    public EvidenceValidationResult validate(final String evidenceText,
                                             final String controlId,
                                             final AlignedCorpus requirements,
                                             final double threshold) {
        if (StringUtils.isBlank(evidenceText)) {
            return EvidenceValidationResult.invalid("Evidence contains no extractable text.", threshold);
        }

        final AlignedCorpus linked = requirements.subset(record -> Objects.equals(record.foreignKey(), controlId));
        final AlignedCorpus scope = linked.isEmpty() ? requirements : linked;
        final String caveat = linked.isEmpty()
                ? "Note: No direct requirement link found for " + controlId + ". "
                : "";

        if (linked.isEmpty()) {
            logger.warning("No requirements are linked to control " + controlId + ", searching all " + requirements.size() + " requirements");
        }

        if (scope.isEmpty()) {
            return EvidenceValidationResult.invalid("No requirements found for control " + controlId + ".", threshold);
        }

        final SimilarityIndex index = new SimilarityIndex(scope.vectors());
        final List<MatchCandidate> candidates = candidateRetriever.retrieve(
                controlId,
                embeddingModel.embed(evidenceText),
                index,
                scope.records(),
                evidenceConfig.getMaxMatches());

        final List<EvidenceMatch> matches = candidates.stream()
                .map(candidate -> toMatch(candidate, scope.records().get(candidate.recordIndex())))
                .toList();

        final EvidenceMatch best = matches.stream()
                .filter(match -> match.score() > 0)
                .findFirst()
                .orElse(null);

        if (best == null) {
            return new EvidenceValidationResult(
                    false,
                    0.0,
                    null,
                    null,
                    null,
                    null,
                    caveat + "No suitable requirement matches found for evidence. Evidence may not satisfy requirements for control " + controlId + ".",
                    matches,
                    threshold);
        }

        final boolean valid = best.score() >= threshold;

        return new EvidenceValidationResult(
                valid,
                best.score(),
                best.requirementId(),
                best.title(),
                best.description(),
                best.category(),
                caveat + (valid ? validExplanation(best) : invalidExplanation(best, threshold)),
                matches,
                threshold);
    }

    private EvidenceMatch toMatch(final MatchCandidate candidate, final CorpusRecord record) {
        return new EvidenceMatch(
                record.id(),
                record.title(),
                record.body(),
                record.category(),
                record.foreignKey(),
                candidate.score(),
                confidenceClassifier.classify(candidate.score()));
    }

    private String validExplanation(final EvidenceMatch best) {
        return "Evidence successfully matches requirement '" + best.title() + "' with high confidence "
                + "(score: " + ScoreFormat.format(best.score(), 3) + "). "
                + "The evidence content aligns with the requirement: '" + preview(best.description()) + "...'";
    }

    private String invalidExplanation(final EvidenceMatch best, final double threshold) {
        return "Evidence partially matches requirement '" + best.title() + "' but confidence is below threshold "
                + "(score: " + ScoreFormat.format(best.score(), 3) + ", required: " + threshold + "). "
                + "Manual review recommended. Best match requirement: '" + preview(best.description()) + "...'";
    }

    private String preview(final String description) {
        return StringUtils.left(description, DESCRIPTION_PREVIEW_LENGTH);
    }
}
