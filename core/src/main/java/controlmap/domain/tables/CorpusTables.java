package controlmap.domain.tables;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import controlmap.domain.corpus.CorpusRecord;
import controlmap.domain.corpus.PolicyClause;
import controlmap.domain.exceptions.InternalFailure;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jspecify.annotations.Nullable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps the rows of the control, requirement and clause tables onto typed records.
 */
@ApplicationScoped
public class CorpusTables {
    public static final String CONTROL_ID = "scf_id";
    public static final String CONTROL_DOMAIN = "domain";
    public static final String CONTROL_TITLE = "control_title";
    public static final String CONTROL_TEXT = "text";

    public static final String REQUIREMENT_ID = "erl_id";
    public static final String REQUIREMENT_AREA = "area_focus";
    public static final String REQUIREMENT_NAME = "artifact_name";
    public static final String REQUIREMENT_DESCRIPTION = "artifact_desc";
    public static final String REQUIREMENT_CONTROL_ID = "scf_id";

    public static final String CLAUSE_POLICY_ID = "policy_id";
    public static final String CLAUSE_INDEX = "clause_index";
    public static final String CLAUSE_TEXT = "clause_text";

    private static final String DEFAULT_POLICY_ID = "example_policy";

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    @Inject
    private TableReader tableReader;

    /**
     * Controls (or control sentences). Several rows may share a control id.
     */
    public List<CorpusRecord> readControls(final Path path) {
        return tableReader.read(path, List.of(CONTROL_ID, CONTROL_DOMAIN, CONTROL_TEXT))
                .stream()
                .map(row -> new CorpusRecord(
                        cell(row, CONTROL_ID),
                        cell(row, CONTROL_DOMAIN),
                        optionalCell(row, CONTROL_TITLE),
                        cell(row, CONTROL_TEXT),
                        null))
                .toList();
    }

    /**
     * Evidence requirements, each linked to the control it provides evidence for.
     */
    public List<CorpusRecord> readRequirements(final Path path) {
        return tableReader.read(path, List.of(
                        REQUIREMENT_ID,
                        REQUIREMENT_AREA,
                        REQUIREMENT_NAME,
                        REQUIREMENT_DESCRIPTION,
                        REQUIREMENT_CONTROL_ID))
                .stream()
                .map(row -> new CorpusRecord(
                        cell(row, REQUIREMENT_ID),
                        cell(row, REQUIREMENT_AREA),
                        cell(row, REQUIREMENT_NAME),
                        cell(row, REQUIREMENT_DESCRIPTION),
                        optionalCell(row, REQUIREMENT_CONTROL_ID)))
                .toList();
    }

    /**
     * Policy clauses in file order. The policy id and clause index columns are optional. Without an index
     * column, clauses are numbered from 1.
     */
    public List<PolicyClause> readClauses(final Path path) {
        final List<Map<String, String>> rows = tableReader.read(path, List.of(CLAUSE_TEXT));
        final List<PolicyClause> clauses = new ArrayList<>();

        for (int i = 0; i < rows.size(); i++) {
            final Map<String, String> row = rows.get(i);
            clauses.add(new PolicyClause(
                    StringUtils.defaultIfBlank(optionalCell(row, CLAUSE_POLICY_ID), DEFAULT_POLICY_ID),
                    NumberUtils.toInt(optionalCell(row, CLAUSE_INDEX), i + 1),
                    cell(row, CLAUSE_TEXT)));
        }

        return clauses;
    }

    public void writeClauses(final Path path, final List<PolicyClause> clauses) {
        final CsvSchema schema = CSV_MAPPER.schemaFor(PolicyClause.class).withHeader();

        Try.run(() -> {
                    if (path.toAbsolutePath().getParent() != null) {
                        Files.createDirectories(path.toAbsolutePath().getParent());
                    }
                    CSV_MAPPER.writer(schema).writeValue(path.toFile(), clauses);
                })
                .getOrElseThrow(ex -> new InternalFailure("Failed to write clause table " + path, ex));
    }

    private String cell(final Map<String, String> row, final String column) {
        return StringUtils.strip(StringUtils.defaultString(row.get(column)));
    }

    @Nullable
    private String optionalCell(final Map<String, String> row, final String column) {
        return StringUtils.trimToNull(row.get(column));
    }
}
