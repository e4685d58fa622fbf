package controlmap.domain.corpus;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One clause of a policy document, as written to and read from a clause table.
 *
 * @param policyId    The policy the clause came from
 * @param clauseIndex The position of the clause in the policy
 * @param text        The clause text
 */
@JsonPropertyOrder({"policy_id", "clause_index", "clause_text"})
public record PolicyClause(@JsonProperty("policy_id") String policyId,
                           @JsonProperty("clause_index") int clauseIndex,
                           @JsonProperty("clause_text") String text) {

    /**
     * Clauses take part in alignment like any other corpus record.
     */
    public CorpusRecord toCorpusRecord() {
        return new CorpusRecord(policyId + "#" + clauseIndex, policyId, text);
    }
}
