package controlmap.domain.tables;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import controlmap.domain.exceptions.InternalFailure;
import controlmap.domain.exceptions.NotFound;
import controlmap.domain.exceptions.SchemaError;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads CSV files with a header row.
 */
@ApplicationScoped
public class CsvTableReader implements TableReader {
    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    @Inject
    private Logger logger;

    @Override
    public List<Map<String, String>> read(final Path path, final Collection<String> requiredColumns) {
        if (!Files.isRegularFile(path)) {
            throw new NotFound("Table not found: " + path);
        }

        final List<Map<String, String>> rows = Try.withResources(() -> CSV_MAPPER
                        .readerForMapOf(String.class)
                        .with(CsvSchema.emptySchema().withHeader())
                        .<Map<String, String>>readValues(path.toFile()))
                .of(iterator -> readRows(path, iterator, requiredColumns))
                .getOrElseThrow(ex -> ex instanceof SchemaError schemaError
                        ? schemaError
                        : new InternalFailure("Failed to read table " + path, ex));

        logger.fine("Read " + rows.size() + " rows from " + path);

        return rows;
    }

    private List<Map<String, String>> readRows(final Path path,
                                               final MappingIterator<Map<String, String>> iterator,
                                               final Collection<String> requiredColumns) throws Exception {
        // hasNext() forces the header line to be parsed, even when there are no data rows
        iterator.hasNext();

        final List<String> columns = new ArrayList<>();
        if (iterator.getParserSchema() instanceof CsvSchema schema) {
            schema.forEach(column -> columns.add(column.getName()));
        }

        final List<String> missing = requiredColumns.stream()
                .filter(column -> !columns.contains(column))
                .toList();

        if (!missing.isEmpty()) {
            throw new SchemaError("Table " + path + " is missing columns " + missing + ". Available columns: " + columns);
        }

        return iterator.readAll();
    }
}
