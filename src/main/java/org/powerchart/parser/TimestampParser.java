package org.powerchart.parser;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns log timestamps into epoch seconds.
 *
 * <p>The parser holds an ordered list of accepted formats. Each format has a pattern that
 * decides whether it applies and captures the part handed to its formatter; the first format
 * whose pattern matches wins. Time zone abbreviations such as {@code EST} are matched but not
 * interpreted: all times are local wall-clock times of the configured zone.</p>
 */
public final class TimestampParser {

    /**
     * One accepted timestamp layout.
     */
    public record AcceptedFormat(String name, Pattern guard, DateTimeFormatter formatter) {

        public AcceptedFormat {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(guard, "guard");
            Objects.requireNonNull(formatter, "formatter");
        }

        static AcceptedFormat of(String name, String guard, String pattern) {
            DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern(pattern)
                    .toFormatter(Locale.US);
            return new AcceptedFormat(name, Pattern.compile(guard), formatter);
        }
    }

    /** UPS trendlog: separate date and time columns joined by a space. */
    public static final List<AcceptedFormat> UPS_FORMATS = List.of(
            AcceptedFormat.of("ups-short-year",
                    "^(\\d{1,2}/\\d{1,2}/\\d{2} \\d{1,2}:\\d{2})$", "M/d/yy H:mm"),
            AcceptedFormat.of("ups-long-year",
                    "^(\\d{1,2}/\\d{1,2}/\\d{4} \\d{1,2}:\\d{2})$", "M/d/yyyy H:mm"));

    /** Enterprise aisle log: twelve-hour clock followed by a zone abbreviation. */
    public static final List<AcceptedFormat> ENT_FORMATS = List.of(
            AcceptedFormat.of("ent-short-year",
                    "^(\\d{1,2}/\\d{1,2}/\\d{2} \\d{1,2}:\\d{2}:\\d{2} [AaPp][Mm])(?: [A-Za-z]{2,5})?$",
                    "M/d/yy h:mm:ss a"),
            AcceptedFormat.of("ent-long-year",
                    "^(\\d{1,2}/\\d{1,2}/\\d{4} \\d{1,2}:\\d{2}:\\d{2} [AaPp][Mm])(?: [A-Za-z]{2,5})?$",
                    "M/d/yyyy h:mm:ss a"));

    private final List<AcceptedFormat> formats;
    private final ZoneId zone;

    public TimestampParser(List<AcceptedFormat> formats, ZoneId zone) {
        if (formats.isEmpty()) {
            throw new IllegalArgumentException("at least one format is required");
        }
        this.formats = List.copyOf(formats);
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public static TimestampParser forUps(ZoneId zone) {
        return new TimestampParser(UPS_FORMATS, zone);
    }

    public static TimestampParser forEnterprise(ZoneId zone) {
        return new TimestampParser(ENT_FORMATS, zone);
    }

    /**
     * Parses the text with the first format that accepts it.
     *
     * @throws TimestampParseException if no format accepts the text or the date does not exist
     */
    public LocalDateTime parseLocal(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim().replaceAll("\\s+", " ");

        for (AcceptedFormat format : formats) {
            Matcher matcher = format.guard().matcher(trimmed);
            if (!matcher.matches()) {
                continue;
            }
            try {
                return LocalDateTime.parse(matcher.group(1), format.formatter());
            } catch (DateTimeParseException ex) {
                throw new TimestampParseException(text, ex);
            }
        }
        throw new TimestampParseException(text);
    }

    public long toEpochSecond(String text) {
        return parseLocal(text).atZone(zone).toEpochSecond();
    }
}
