package controlmap.domain.converter;

import java.nio.file.Path;

/**
 * Converts a policy document or an evidence artifact to plain text.
 */
public interface FileToText {
    String convert(Path path);
}
