package controlmap.domain.mapping;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import controlmap.domain.merge.MergedMatch;

/**
 * One control a clause was mapped to, as written to the mapping results file.
 */
@JsonPropertyOrder({"matched_id", "matched_category", "matched_text", "confidence", "explanation"})
public record MappingExplanation(@JsonProperty("matched_id") String matchedId,
                                 @JsonProperty("matched_category") String matchedCategory,
                                 @JsonProperty("matched_text") String matchedText,
                                 @JsonProperty("confidence") String confidence,
                                 @JsonProperty("explanation") String explanation) {

    public static MappingExplanation fromMatch(final MergedMatch match) {
        return new MappingExplanation(
                match.candidate().matchedId(),
                match.candidate().matchedCategory(),
                match.candidate().matchedText(),
                match.confidenceLabel(),
                match.explanation());
    }
}
