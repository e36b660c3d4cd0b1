package phoenixcenter.defenceprofiler.io;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes rows to a delimited file, creating missing parent directories. A null value is written as
 * an empty field.
 */
public class DelimitedWriter implements Closeable {

    private final BufferedWriter bw;

    private final Delimiter delimiter;

    public DelimitedWriter(Path path, Delimiter delimiter) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.bw = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        this.delimiter = delimiter;
    }

    public void writeRow(List<String> values) throws IOException {
        bw.write(values.stream()
                .map(v -> v == null ? "" : delimiter.escape(v))
                .collect(Collectors.joining(delimiter.separator())));
        bw.write(System.lineSeparator());
    }

    @Override
    public void close() throws IOException {
        bw.close();
    }
}
