package controlmap.domain.confidence;

import controlmap.domain.retrieval.MatchCandidate;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Locale;

/**
 * Fills fixed sentence templates. The output depends only on the candidate and the band.
 */
@ApplicationScoped
public class TemplateExplanationGenerator implements ExplanationGenerator {
    @Override
    public String explain(final MatchCandidate candidate, final ConfidenceBand band) {
        return "This clause likely aligns with control text that says: '" + candidate.matchedText() + "'. "
                + "The semantic similarity score is " + ScoreFormat.format(candidate.score(), 2)
                + ", suggesting a " + band.getLabel().toLowerCase(Locale.ROOT) + " match.";
    }

    @Override
    public String fallbackLabel(final MatchCandidate candidate) {
        return ConfidenceBand.FALLBACK.getLabel() + " (Fallback, Sim=" + ScoreFormat.format(candidate.score(), 2) + ")";
    }

    @Override
    public String explainFallback(final MatchCandidate candidate) {
        return "No strong semantic match found, but this clause loosely relates to '" + candidate.matchedText() + "' "
                + "with similarity " + ScoreFormat.format(candidate.score(), 2) + ".";
    }
}
