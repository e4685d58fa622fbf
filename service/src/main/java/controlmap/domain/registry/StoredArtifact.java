package controlmap.domain.registry;

import org.jspecify.annotations.Nullable;

/**
 * Where the registry keeps a copy of an evidence file.
 *
 * @param storedFilePath The path of the kept copy, or the original path when nothing was copied
 * @param storedFileName The file name of the kept copy
 * @param fileType       The detected media type, or null when the file could not be read
 */
public record StoredArtifact(String storedFilePath, String storedFileName, @Nullable String fileType) {
}
