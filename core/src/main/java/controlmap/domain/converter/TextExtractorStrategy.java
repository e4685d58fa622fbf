package controlmap.domain.converter;

import java.nio.file.Path;

/**
 * Extracts text from supported files.
 */
public interface TextExtractorStrategy {
    /**
     * @throws controlmap.domain.exceptions.ExtractionFailed if the file could not be read or parsed
     */
    String convert(Path path);

    boolean isSupported(Path path);

    /**
     * Extractors with a lower priority value are tried first.
     */
    int priority();
}
