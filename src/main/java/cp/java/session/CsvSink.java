package cp.java.session;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only CSV output for scan results.
 *
 * The header row is written only when the file did not exist before opening.
 * Every row is flushed immediately so partial results survive an abrupt exit.
 *
 * Thread-safety: {@link #writeRow(String...)} is synchronized; workers share
 * one sink.
 */
public final class CsvSink implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(CsvSink.class);
    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    static final List<String> HEADER = List.of("Repository name", "Signature name", "Matching file", "Matches");

    private final Path path;
    private final Writer out;
    private final SequenceWriter rows;

    private CsvSink(Path path, Writer out, SequenceWriter rows) {
        this.path = path;
        this.out = out;
        this.rows = rows;
    }

    /**
     * Opens (creating if needed) the file in append mode.
     *
     * @param path CSV file path
     * @return an open sink
     * @throws IOException if the file cannot be opened
     */
    public static CsvSink open(Path path) throws IOException {
        boolean writeHeader = !Files.exists(path);

        Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        SequenceWriter rows;
        try {
            rows = CSV_MAPPER.writer(CsvSchema.emptySchema()).writeValues(out);
        } catch (IOException e) {
            out.close();
            throw e;
        }

        CsvSink sink = new CsvSink(path, out, rows);
        if (writeHeader) {
            sink.writeRow(HEADER.toArray(new String[0]));
        }
        LOG.debug("CSV output opened at {} (header written: {})", path, writeHeader);
        return sink;
    }

    public Path path() {
        return path;
    }

    /**
     * Writes and flushes one row.
     *
     * @param columns column values
     * @throws UncheckedIOException if the write fails
     */
    public synchronized void writeRow(String... columns) {
        try {
            rows.write(columns);
            rows.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV row to " + path, e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        try {
            rows.close();
        } finally {
            out.close();
        }
    }
}
