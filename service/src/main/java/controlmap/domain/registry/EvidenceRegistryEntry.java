package controlmap.domain.registry;

import controlmap.domain.evidence.EvidenceValidationResult;
import controlmap.domain.evidenceprocessing.EvidenceProcessingResult;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * One line of the evidence registry. The stored file path points at the registry's own copy of the evidence
 * when processing succeeded, and at the submitted file otherwise.
 */
public record EvidenceRegistryEntry(Instant timestamp,
                                    String controlId,
                                    String fileName,
                                    String filePath,
                                    String storedFilePath,
                                    String storedFileName,
                                    @Nullable String fileType,
                                    long fileSize,
                                    boolean valid,
                                    double confidence,
                                    @Nullable String matchedId,
                                    @Nullable String matchedTitle,
                                    @Nullable String matchedDescription,
                                    @Nullable String matchedCategory,
                                    @Nullable String explanation,
                                    String preview,
                                    double threshold,
                                    boolean success,
                                    @Nullable String error) {
    private static final int PREVIEW_LENGTH = 500;

    public static EvidenceRegistryEntry fromResult(final EvidenceProcessingResult result,
                                                   final double threshold,
                                                   final Instant timestamp,
                                                   final StoredArtifact artifact) {
        final EvidenceValidationResult validation = result.validation();

        return new EvidenceRegistryEntry(
                timestamp,
                result.controlId(),
                result.fileName(),
                result.filePath(),
                artifact.storedFilePath(),
                artifact.storedFileName(),
                artifact.fileType(),
                result.fileSize(),
                result.isValid(),
                validation == null ? 0.0 : validation.confidenceScore(),
                validation == null ? null : validation.matchedId(),
                validation == null ? null : validation.matchedTitle(),
                validation == null ? null : validation.matchedDescription(),
                validation == null ? null : validation.matchedCategory(),
                validation == null ? null : validation.explanation(),
                StringUtils.left(result.extractedTextPreview(), PREVIEW_LENGTH),
                validation == null ? threshold : validation.threshold(),
                result.success(),
                result.error());
    }
}
