package controlmap.domain.evidence;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The outcome of validating one piece of evidence against the requirements of a control.
 *
 * @param valid              Whether the best match reached the threshold
 * @param confidenceScore    The score of the best match, or 0 when there was none
 * @param matchedId          The id of the best matching requirement
 * @param matchedTitle       The title of the best matching requirement
 * @param matchedDescription The description of the best matching requirement
 * @param matchedCategory    The area of focus of the best matching requirement
 * @param explanation        A human readable summary of the result
 * @param matches            The ranked requirement matches
 * @param threshold          The threshold the evidence was validated with
 */
public record EvidenceValidationResult(boolean valid,
                                       double confidenceScore,
                                       @Nullable String matchedId,
                                       @Nullable String matchedTitle,
                                       @Nullable String matchedDescription,
                                       @Nullable String matchedCategory,
                                       String explanation,
                                       List<EvidenceMatch> matches,
                                       double threshold) {
    public EvidenceValidationResult {
        matches = List.copyOf(matches);
    }

    /**
     * A result for evidence that could not be matched to anything.
     */
    public static EvidenceValidationResult invalid(final String explanation, final double threshold) {
        return new EvidenceValidationResult(false, 0.0, null, null, null, null, explanation, List.of(), threshold);
    }
}
