package controlmap.domain.evidence;

import controlmap.domain.corpus.AlignedCorpus;

/**
 * Decides whether a piece of evidence satisfies the requirements of a control.
 */
public interface EvidenceValidator {
    /**
     * @param evidenceText The text extracted from the evidence artifact
     * @param controlId    The control the evidence is submitted for
     * @param requirements The whole requirement corpus, with one vector per requirement
     * @param threshold    The score the best match must reach for the evidence to be valid
     * @return The validation result. Missing text or requirements produce an invalid result rather than an
     * exception.
     */
    EvidenceValidationResult validate(String evidenceText, String controlId, AlignedCorpus requirements, double threshold);
}
