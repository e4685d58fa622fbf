package controlmap.domain.evidenceprocessing;

import java.nio.file.Path;

/**
 * Validates an evidence file against the requirements of a control.
 */
public interface EvidenceProcessingPipeline {
    /**
     * Never throws. Failures are reported through {@link EvidenceProcessingResult#success()}.
     *
     * @param evidencePath The evidence file
     * @param controlId    The control the evidence is submitted for
     * @param threshold    The score the best requirement match must reach
     */
    EvidenceProcessingResult process(Path evidencePath, String controlId, double threshold);
}
