package controlmap.domain.registry;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Keeps copies of evidence files so registry entries still resolve after the submitted file is moved or
 * deleted.
 */
public interface EvidenceArtifactStore {
    /**
     * Copies the file into the artifact directory under a name prefixed with the timestamp.
     */
    StoredArtifact store(Path source, Instant timestamp);

    /**
     * Describes the file where it is, without copying it.
     */
    StoredArtifact reference(Path source);
}
