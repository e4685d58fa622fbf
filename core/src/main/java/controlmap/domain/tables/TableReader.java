package controlmap.domain.tables;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Reads a tabular file wholesale into rows keyed by column name.
 */
public interface TableReader {
    /**
     * @param path            The table to read
     * @param requiredColumns The columns that must be present in the header
     * @return The rows, in file order
     * @throws controlmap.domain.exceptions.NotFound    if the file does not exist
     * @throws controlmap.domain.exceptions.SchemaError if a required column is missing
     */
    List<Map<String, String>> read(Path path, Collection<String> requiredColumns);
}
