package controlmap.domain.converter;

import controlmap.domain.exceptions.ExtractionFailed;
import controlmap.domain.exceptions.NotFound;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;

/**
 * Hands the file to the most specific extractor that supports it.
 */
@ApplicationScoped
public class FileToTextContext implements FileToText {

    @Inject
    private Instance<TextExtractorStrategy> textExtractors;

    @Override
    public String convert(final Path path) {
        if (!Files.isRegularFile(path)) {
            throw new NotFound("File " + path + " does not exist");
        }

        return textExtractors
                .stream()
                .sorted(Comparator.comparingInt(TextExtractorStrategy::priority))
                .filter(extractor -> extractor.isSupported(path))
                .findFirst()
                .map(extractor -> extractor.convert(path))
                .orElseThrow(() -> new ExtractionFailed("No text extractor supports " + path));
    }
}
