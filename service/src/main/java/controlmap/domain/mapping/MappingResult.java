package controlmap.domain.mapping;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The controls a single policy clause was mapped to.
 *
 * @param queryId      The policy the clause belongs to
 * @param queryIndex   The index of the clause within the policy
 * @param queryText    The clause text
 * @param explanations The matched controls, best first
 */
@JsonPropertyOrder({"query_id", "query_index", "query_text", "mapping_explanations"})
public record MappingResult(@JsonProperty("query_id") String queryId,
                            @JsonProperty("query_index") int queryIndex,
                            @JsonProperty("query_text") String queryText,
                            @JsonProperty("mapping_explanations") List<MappingExplanation> explanations) {
    public MappingResult {
        explanations = List.copyOf(explanations);
    }
}
