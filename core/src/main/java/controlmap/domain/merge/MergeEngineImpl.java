package controlmap.domain.merge;

import controlmap.domain.confidence.ConfidenceBand;
import controlmap.domain.confidence.ConfidenceClassifier;
import controlmap.domain.confidence.ExplanationGenerator;
import controlmap.domain.config.MergeConfig;
import controlmap.domain.retrieval.MatchCandidate;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps candidates above the threshold, best first, and drops any candidate whose matched record was
 * already merged or whose text is nearly identical to the text of a merged match. Control sentences
 * often repeat the same wording under different ids, and reporting each of them adds nothing.
 * <p>
 * The sort is stable, so candidates with equal scores keep their retrieval order.
 */
@ApplicationScoped
public class MergeEngineImpl implements MergeEngine {
    private static final Comparator<MatchCandidate> BEST_FIRST =
            Comparator.comparingDouble(MatchCandidate::score).reversed();

    @Inject
    private MergeConfig mergeConfig;

    @Inject
    private TextSimilarity textSimilarity;

    @Inject
    private ConfidenceClassifier confidenceClassifier;

    @Inject
    private ExplanationGenerator explanationGenerator;

    @Override
    public MergeResult merge(final List<MatchCandidate> candidates, final double threshold) {
        if (candidates.isEmpty()) {
            return MergeResult.noMatch();
        }

        final List<MatchCandidate> sorted = candidates.stream()
                .filter(candidate -> candidate.score() >= threshold)
                .sorted(BEST_FIRST)
                .toList();

        final List<MergedMatch> merged = new ArrayList<>();
        final Set<String> seenIds = new HashSet<>();

        for (final MatchCandidate candidate : sorted) {
            // the id is claimed even when the text check below rejects the candidate
            if (!seenIds.add(candidate.matchedId())) {
                continue;
            }

            if (isNearDuplicate(merged, candidate)) {
                continue;
            }

            final ConfidenceBand band = confidenceClassifier.classify(candidate.score());
            merged.add(new MergedMatch(
                    candidate,
                    band,
                    band.getLabel(),
                    explanationGenerator.explain(candidate, band)));
        }

        if (merged.isEmpty()) {
            return new MergeResult(MergeOutcome.FALLBACK_MATCH, List.of(fallback(candidates)));
        }

        return new MergeResult(MergeOutcome.NORMAL_MATCHES, merged);
    }

    private boolean isNearDuplicate(final List<MergedMatch> merged, final MatchCandidate candidate) {
        final double maxRatio = merged.stream()
                .mapToDouble(match -> textSimilarity.ratio(match.candidate().matchedText(), candidate.matchedText()))
                .max()
                .orElse(0.0);

        return maxRatio >= mergeConfig.getDedupThreshold();
    }

    private MergedMatch fallback(final List<MatchCandidate> candidates) {
        // the first of the best scoring candidates, in retrieval order
        MatchCandidate best = candidates.get(0);
        for (final MatchCandidate candidate : candidates) {
            if (candidate.score() > best.score()) {
                best = candidate;
            }
        }

        return new MergedMatch(
                best,
                ConfidenceBand.FALLBACK,
                explanationGenerator.fallbackLabel(best),
                explanationGenerator.explainFallback(best));
    }
}
