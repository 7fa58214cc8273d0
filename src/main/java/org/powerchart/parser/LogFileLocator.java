package org.powerchart.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the per-day log files of each source in the data directory.
 */
public class LogFileLocator {

    private static final Pattern HPC_FILE_NAME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}\\.csv");
    private static final DateTimeFormatter HPC_FILE_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Path directory;
    private final String upsPrefix;
    private final String entPrefix;

    public LogFileLocator(Path directory, String upsPrefix, String entPrefix) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.upsPrefix = Objects.requireNonNull(upsPrefix, "upsPrefix");
        this.entPrefix = Objects.requireNonNull(entPrefix, "entPrefix");
    }

    /**
     * HPC polling files named {@code yyyy-MM-dd.csv} dated within {@code [from, to]}, oldest first.
     */
    public List<Path> hpcFiles(LocalDate from, LocalDate to) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(Files::isReadable)
                    .filter(path -> fileDate(path).map(date -> !date.isBefore(from) && !date.isAfter(to)).orElse(false))
                    .sorted(Comparator.comparing(path -> fileDate(path).orElseThrow()))
                    .collect(Collectors.toList());
        }
    }

    public List<Path> upsFiles() throws IOException {
        return filesWithPrefix(upsPrefix);
    }

    public List<Path> entFiles() throws IOException {
        return filesWithPrefix(entPrefix);
    }

    /**
     * Date encoded in an HPC file name, if the name has the expected layout.
     */
    public static Optional<LocalDate> fileDate(Path path) {
        String name = path.getFileName().toString();
        if (!HPC_FILE_NAME.matcher(name).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(name.substring(0, 10), HPC_FILE_DATE));
        } catch (DateTimeParseException ex) {
            // names like 2024-02-30.csv match the layout but are not dates
            return Optional.empty();
        }
    }

    private List<Path> filesWithPrefix(String prefix) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(Files::isReadable)
                    .filter(path -> path.getFileName().toString().startsWith(prefix))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }
}
