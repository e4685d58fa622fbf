package controlmap.domain.evidence;

import controlmap.domain.confidence.ConfidenceBand;
import org.jspecify.annotations.Nullable;

/**
 * A requirement that evidence was compared against.
 *
 * @param requirementId The requirement id
 * @param title         The artifact name of the requirement
 * @param description   The artifact description of the requirement
 * @param category      The area of focus of the requirement
 * @param controlId     The control the requirement is linked to
 * @param score         The cosine similarity between the evidence and the requirement
 * @param band          The confidence band of the score
 */
public record EvidenceMatch(String requirementId,
                            @Nullable String title,
                            String description,
                            String category,
                            @Nullable String controlId,
                            double score,
                            ConfidenceBand band) {
}
