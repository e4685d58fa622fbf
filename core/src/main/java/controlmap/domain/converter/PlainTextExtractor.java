package controlmap.domain.converter;

import controlmap.domain.exceptions.ExtractionFailed;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.io.FilenameUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Reads text files as UTF-8 without going through a parser.
 */
@ApplicationScoped
public class PlainTextExtractor implements TextExtractorStrategy {
    private static final Set<String> EXTENSIONS = Set.of("txt", "md", "csv", "log", "json");

    @Override
    public String convert(final Path path) {
        return Try.of(() -> Files.readString(path, StandardCharsets.UTF_8))
                .getOrElseThrow(ex -> new ExtractionFailed("Failed to read " + path, ex));
    }

    @Override
    public boolean isSupported(final Path path) {
        final String extension = FilenameUtils.getExtension(path.getFileName().toString());
        return EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    @Override
    public int priority() {
        return 0;
    }
}
