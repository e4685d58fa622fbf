package controlmap.domain.evidenceprocessing;

import controlmap.domain.evidence.EvidenceValidationResult;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of processing one evidence file. When a step fails, success is false, error holds the reason
 * and validation is null.
 *
 * @param success              Whether every step completed
 * @param error                Why processing failed
 * @param fileName             The name of the evidence file
 * @param filePath             The path of the evidence file
 * @param fileSize             The size of the evidence file in bytes, or 0 if unknown
 * @param controlId            The control the evidence was submitted for
 * @param extractedTextPreview The start of the extracted text
 * @param validation           The validation result
 */
public record EvidenceProcessingResult(boolean success,
                                       @Nullable String error,
                                       String fileName,
                                       String filePath,
                                       long fileSize,
                                       String controlId,
                                       String extractedTextPreview,
                                       @Nullable EvidenceValidationResult validation) {

    public static EvidenceProcessingResult failure(final String error,
                                                   final String fileName,
                                                   final String filePath,
                                                   final long fileSize,
                                                   final String controlId,
                                                   final String extractedTextPreview) {
        return new EvidenceProcessingResult(false, error, fileName, filePath, fileSize, controlId, extractedTextPreview, null);
    }

    public boolean isValid() {
        return success && validation != null && validation.valid();
    }
}
