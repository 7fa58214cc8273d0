package org.powerchart.parser;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Represents a single CSV row together with the file it was read from.
 */
public record SourceRow(Path file, int lineNumber, Map<String, String> fields) {

    public SourceRow {
        fields = Map.copyOf(fields);
    }

    public Optional<String> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    /**
     * Returns the field or fails with a message naming the file and line.
     */
    public String require(String name) {
        String value = fields.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing column '" + name + "' in " + location());
        }
        return value;
    }

    public String location() {
        return (file == null ? "<input>" : file.getFileName().toString()) + ":" + lineNumber;
    }
}
