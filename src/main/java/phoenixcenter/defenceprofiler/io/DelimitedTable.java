package phoenixcenter.defenceprofiler.io;

import lombok.extern.log4j.Log4j2;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A whole delimited file held as rows of named columns. Blank lines are skipped; a row shorter than
 * the header simply lacks the trailing columns.
 */
@Log4j2
public class DelimitedTable {

    private final List<String> columns;

    private final List<Map<String, String>> rows;

    private DelimitedTable(List<String> columns, List<Map<String, String>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Read a file whose first non-blank line names the columns. A zero-byte file gives a table
     * without columns and rows.
     */
    public static DelimitedTable read(Path path, Delimiter delimiter) throws IOException {
        return read(path, delimiter, null);
    }

    /**
     * Read a headerless file, naming its columns by position.
     *
     * @param columns column names, or null when the first line is the header
     */
    public static DelimitedTable read(Path path, Delimiter delimiter, List<String> columns) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                if (line.trim().isEmpty()) {
                    continue;
                }
                List<String> fields = delimiter.split(line);
                if (columns == null) {
                    columns = new ArrayList<>(fields.size());
                    for (String field : fields) {
                        columns.add(field.trim());
                    }
                    continue;
                }
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size() && i < fields.size(); i++) {
                    row.put(columns.get(i), fields.get(i));
                }
                rows.add(row);
            }
        }
        if (columns == null) {
            columns = Collections.emptyList();
        }
        log.debug("read {} rows from {}", rows.size(), path);
        return new DelimitedTable(Collections.unmodifiableList(columns), rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, String>> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumns(String... names) {
        return columns.containsAll(Arrays.asList(names));
    }
}
