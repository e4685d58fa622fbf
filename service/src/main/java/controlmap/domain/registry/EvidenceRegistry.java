package controlmap.domain.registry;

import controlmap.domain.evidenceprocessing.EvidenceProcessingResult;

import java.util.List;

/**
 * An append-only log of evidence processing results.
 */
public interface EvidenceRegistry {
    EvidenceRegistryEntry register(EvidenceProcessingResult result, double threshold);

    /**
     * @return Every entry in the order it was registered
     */
    List<EvidenceRegistryEntry> load();

    List<EvidenceRegistryEntry> findByControlId(String controlId);

    EvidenceSummary summary();
}
