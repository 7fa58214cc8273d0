package org.powerchart.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads comma separated log files whose first line names the columns.
 *
 * <p>Fields may be enclosed in double quotes, in which case commas are kept and {@code ""}
 * stands for a single quote. Blank lines are skipped. A line with fewer fields than the header
 * simply lacks the trailing columns.</p>
 */
public final class CsvRowReader {

    private static final char SEPARATOR = ',';
    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    /**
     * Parses the provided CSV file.
     *
     * @param path path to the file
     * @return rows in file order
     * @throws IOException if reading the file fails
     */
    public List<SourceRow> read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path);
        }
    }

    /**
     * Parses CSV data from the provided reader.
     *
     * @param reader reader with CSV data
     * @param file   file the data belongs to, may be {@code null}
     * @return rows in input order
     * @throws IOException if reading from the reader fails
     */
    public List<SourceRow> read(Reader reader, Path file) throws IOException {
        Objects.requireNonNull(reader, "reader");

        List<SourceRow> rows = new ArrayList<>();
        try (BufferedReader bufferedReader = reader instanceof BufferedReader br ? br : new BufferedReader(reader)) {
            List<String> header = null;
            String line;
            int lineNumber = 0;

            while ((line = bufferedReader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BOM) {
                    line = line.substring(1);
                }
                if (line.isBlank()) {
                    continue;
                }

                List<String> values = splitLine(line);
                if (header == null) {
                    header = values;
                    continue;
                }

                Map<String, String> fields = new LinkedHashMap<>();
                for (int i = 0; i < header.size() && i < values.size(); i++) {
                    fields.put(header.get(i), values.get(i));
                }
                rows.add(new SourceRow(file, lineNumber, fields));
            }
        }

        return rows;
    }

    static List<String> splitLine(String line) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == QUOTE && i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                    current.append(QUOTE);
                    i++;
                } else if (ch == QUOTE) {
                    quoted = false;
                } else {
                    current.append(ch);
                }
            } else if (ch == QUOTE) {
                quoted = true;
            } else if (ch == SEPARATOR) {
                values.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        values.add(current.toString().trim());
        return values;
    }
}
