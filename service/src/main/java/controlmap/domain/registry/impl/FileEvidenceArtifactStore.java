package controlmap.domain.registry.impl;

import controlmap.domain.config.DataPaths;
import controlmap.domain.exceptions.InternalFailure;
import controlmap.domain.registry.EvidenceArtifactStore;
import controlmap.domain.registry.StoredArtifact;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.tika.Tika;
import org.jspecify.annotations.Nullable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Logger;

/**
 * Copies evidence into a flat directory as yyyyMMdd_HHmmss_name.ext. A copy never replaces an earlier one:
 * when two files with the same name are stored in the same second, the later one gets a numeric suffix.
 */
@ApplicationScoped
public class FileEvidenceArtifactStore implements EvidenceArtifactStore {
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneId.systemDefault());

    private static final Tika TIKA = new Tika();

    @Inject
    private DataPaths dataPaths;

    @Inject
    private Logger logger;

    @Override
    public StoredArtifact store(final Path source, final Instant timestamp) {
        final Path directory = dataPaths.getEvidenceArtifacts();

        final Path stored = Try.of(() -> Files.createDirectories(directory))
                .map(dir -> freeTarget(dir, TIMESTAMP_FORMAT.format(timestamp), source))
                .mapTry(target -> Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES))
                .getOrElseThrow(ex -> new InternalFailure("Failed to copy evidence " + source + " to " + directory, ex));

        logger.info("Stored evidence " + source + " as " + stored);

        return new StoredArtifact(stored.toString(), stored.getFileName().toString(), detectType(stored));
    }

    @Override
    public StoredArtifact reference(final Path source) {
        final String fileName = source.getFileName() == null ? source.toString() : source.getFileName().toString();
        return new StoredArtifact(
                source.toString(),
                fileName,
                Files.isRegularFile(source) ? detectType(source) : null);
    }

    private Path freeTarget(final Path directory, final String prefix, final Path source) {
        final String fileName = source.getFileName().toString();
        final String baseName = FilenameUtils.getBaseName(fileName);
        final String extension = StringUtils.isEmpty(FilenameUtils.getExtension(fileName))
                ? ""
                : "." + FilenameUtils.getExtension(fileName);

        Path target = directory.resolve(prefix + "_" + fileName);
        for (int copy = 1; Files.exists(target); copy++) {
            target = directory.resolve(prefix + "_" + baseName + "_" + copy + extension);
        }
        return target;
    }

    @Nullable
    private String detectType(final Path path) {
        return Try.of(() -> TIKA.detect(path))
                .onFailure(ex -> logger.warning("Failed to detect the type of " + path + ": " + ex.getMessage()))
                .getOrNull();
    }
}
