package com.candlegate.ingest.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Line-oriented CSV helpers for partition files. Values never contain commas or quotes,
 * so no quoting is applied.
 */
public final class CsvUtils {

    private static final Logger log = LoggerFactory.getLogger(CsvUtils.class);

    private CsvUtils() {
    }

    /**
     * Parse every data line of {@code file}. Blank lines are ignored and the first non-blank
     * line is treated as a header when it starts with {@code headerPrefix}.
     *
     * @throws IOException if the file cannot be read, or on the first line the parser rejects
     */
    public static <T> List<T> readCsv(Path file, String headerPrefix, Function<String, T> parser)
            throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<T> rows = new ArrayList<>(lines.size());
        boolean headerChecked = false;

        for (int i = 0; i < lines.size(); i++) {
            String text = lines.get(i).strip();
            if (text.isEmpty()) {
                continue;
            }
            if (!headerChecked) {
                headerChecked = true;
                if (text.startsWith(headerPrefix)) {
                    continue;
                }
            }
            rows.add(parseLine(file, i + 1, text, parser));
        }
        return rows;
    }

    private static <T> T parseLine(Path file, int lineNumber, String text, Function<String, T> parser)
            throws IOException {
        try {
            return parser.apply(text);
        } catch (RuntimeException e) {
            throw new IOException(file.getFileName() + ":" + lineNumber + ": malformed row '" + text + "'", e);
        }
    }

    /**
     * Write {@code header} followed by one formatted line per row, truncating the file first.
     */
    public static <T> void writeCsv(Path file, String header, Collection<T> rows,
                                    Function<T, String> formatter) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write(header);
            out.write('\n');
            for (T row : rows) {
                out.write(formatter.apply(row));
                out.write('\n');
            }
        }
        log.debug("Wrote {} rows to {}", rows.size(), file);
    }
}
