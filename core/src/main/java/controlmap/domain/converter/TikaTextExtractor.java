package controlmap.domain.converter;

import controlmap.domain.exceptions.ExtractionFailed;
import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A global fallback for every file type using Tika. PDF and DOCX policies and most evidence artifacts end
 * up here.
 */
@ApplicationScoped
public class TikaTextExtractor implements TextExtractorStrategy {
    @Override
    public String convert(final Path path) {
        final BodyContentHandler handler = new BodyContentHandler(-1);
        final Parser parser = new AutoDetectParser();
        final ParseContext context = new ParseContext();
        final Metadata metadata = new Metadata();

        Try.withResources(() -> Files.newInputStream(path))
                .of(stream -> parse(parser, stream, handler, metadata, context))
                .mapFailure(API.Case(API.$(), ex -> new ExtractionFailed("Failed to parse file " + path, ex)))
                .get();

        return handler.toString();
    }

    private boolean parse(final Parser parser,
                          final InputStream stream,
                          final BodyContentHandler handler,
                          final Metadata metadata,
                          final ParseContext context) throws Exception {
        parser.parse(stream, handler, metadata, context);
        return true;
    }

    @Override
    public boolean isSupported(final Path path) {
        return true;
    }

    @Override
    public int priority() {
        // Any other extractors will be more specific than this one.
        return Integer.MAX_VALUE;
    }
}
