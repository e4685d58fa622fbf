package controlmap.domain.evidenceprocessing.impl;

import controlmap.domain.alignment.EmbeddingAlignmentManager;
import controlmap.domain.config.DataPaths;
import controlmap.domain.converter.FileToText;
import controlmap.domain.corpus.AlignedCorpus;
import controlmap.domain.corpus.CorpusRecord;
import controlmap.domain.corpus.EmbeddingText;
import controlmap.domain.evidence.EvidenceValidationResult;
import controlmap.domain.evidence.EvidenceValidator;
import controlmap.domain.evidenceprocessing.EvidenceProcessingPipeline;
import controlmap.domain.evidenceprocessing.EvidenceProcessingResult;
import controlmap.domain.exceptionhandling.ExceptionHandler;
import controlmap.domain.exceptionhandling.ExceptionMapping;
import controlmap.domain.exceptions.ExternalException;
import controlmap.domain.tables.CorpusTables;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Extracts the evidence text, loads and aligns the requirements, then validates. Each step reports its own
 * failure message so the caller can tell which one went wrong. Unexpected exceptions are reported as
 * internal failures.
 */
@ApplicationScoped
public class EvidenceProcessingPipelineImpl implements EvidenceProcessingPipeline {
    private static final int PREVIEW_LENGTH = 500;

    @Inject
    private FileToText fileToText;

    @Inject
    private CorpusTables corpusTables;

    @Inject
    private EmbeddingAlignmentManager alignmentManager;

    @Inject
    private EvidenceValidator evidenceValidator;

    @Inject
    private DataPaths dataPaths;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private ExceptionMapping exceptionMapping;

    @Inject
    private Logger logger;

    @Override
    public EvidenceProcessingResult process(final Path evidencePath, final String controlId, final double threshold) {
        final String fileName = evidencePath.getFileName() == null ? "Unknown" : evidencePath.getFileName().toString();
        final String filePath = evidencePath.toString();

        final Try<String> text = exceptionMapping.map(Try.of(() -> StringUtils.normalizeSpace(fileToText.convert(evidencePath))));
        if (text.isFailure()) {
            return failure("", text.getCause(), fileName, filePath, 0L, controlId, "");
        }

        final String evidenceText = text.get();
        final long fileSize = Try.of(() -> Files.size(evidencePath)).getOrElse(0L);
        final String preview = preview(evidenceText);

        final Try<List<CorpusRecord>> requirements = exceptionMapping.map(Try.of(() -> corpusTables.readRequirements(dataPaths.getRequirements())));
        if (requirements.isFailure()) {
            return failure("Failed to load requirements: ", requirements.getCause(),
                    fileName, filePath, fileSize, controlId, preview);
        }

        final Try<AlignedCorpus> corpus = exceptionMapping.map(Try.of(() -> alignmentManager.align(
                requirements.get(),
                dataPaths.getRequirementVectors(),
                EmbeddingText.TITLE_AND_BODY)));
        if (corpus.isFailure()) {
            return failure("Failed to create requirement embeddings: ", corpus.getCause(),
                    fileName, filePath, fileSize, controlId, preview);
        }

        final Try<EvidenceValidationResult> validation = exceptionMapping.map(Try.of(() -> evidenceValidator.validate(
                evidenceText,
                controlId,
                corpus.get(),
                threshold)));
        if (validation.isFailure()) {
            return failure("Validation failed: ", validation.getCause(),
                    fileName, filePath, fileSize, controlId, preview);
        }

        logger.info("Evidence " + fileName + " for control " + controlId + " is "
                + (validation.get().valid() ? "valid" : "not valid") + " with score " + validation.get().confidenceScore());

        return new EvidenceProcessingResult(true, null, fileName, filePath, fileSize, controlId, preview, validation.get());
    }

    private EvidenceProcessingResult failure(final String stage,
                                             final Throwable cause,
                                             final String fileName,
                                             final String filePath,
                                             final long fileSize,
                                             final String controlId,
                                             final String preview) {
        logger.warning("Failed to process evidence " + filePath + ": " + stage + exceptionHandler.getExceptionMessage(cause)
                + (cause instanceof ExternalException ? " Processing may succeed if retried." : ""));
        return EvidenceProcessingResult.failure(
                stage + StringUtils.defaultIfBlank(cause.getMessage(), cause.toString()),
                fileName,
                filePath,
                fileSize,
                controlId,
                preview);
    }

    private String preview(final String text) {
        return text.length() > PREVIEW_LENGTH
                ? text.substring(0, PREVIEW_LENGTH) + "..."
                : text;
    }
}
