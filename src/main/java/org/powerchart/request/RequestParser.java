package org.powerchart.request;

import org.powerchart.model.ChannelCatalog;
import org.powerchart.model.MainRoomView;
import org.powerchart.model.MetricMode;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses the command-line options of the chart tool.
 *
 * <pre>
 * -g GROUP -d DAYS -p POINTS [-s MM/DD/YYYY] [-e MM/DD/YYYY] [-a | -m] [--clean]
 *     [--view whole|ups|ent|hpc|nonmetered] [-o FILE]
 * </pre>
 */
public final class RequestParser {

    public static final String USAGE = """
            usage: power-chart -g GROUP -d DAYS -p POINTS [-s MM/DD/YYYY] [-e MM/DD/YYYY] [-a | -m] [--clean]
                               [--view whole|ups|ent|hpc|nonmetered] [-o FILE]
            sample: power-chart -g 'Com Center Main Room' -d 20 -s 01/05/2024 -p 50 -a
                chart the average power of the Computing Center's main room from Jan 5th to 25th with 50 points
            """;

    static final double DEFAULT_DAYS = 7.0;
    static final int DEFAULT_POINTS = 50;
    static final double MIN_DAYS = 0.08;

    private static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern("M/d/uuuu", Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern DATE = Pattern.compile("\\d{1,2}/\\d{1,2}/\\d{4}");
    private static final Pattern INTEGER = Pattern.compile("[+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+]?(\\d+\\.?\\d*|\\.\\d+)");

    /**
     * Parses the arguments relative to the given current time.
     *
     * @throws RequestParseException if an option is unknown, lacks a value or has an invalid value
     */
    public RequestOptions parse(List<String> args, LocalDateTime now) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(now, "now");

        String group = null;
        MainRoomView view = null;
        LocalDate startDate = null;
        LocalDate endDate = null;
        double days = DEFAULT_DAYS;
        int points = DEFAULT_POINTS;
        boolean average = false;
        boolean maximum = false;
        boolean clean = false;
        Path output = null;

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            String inlineValue = null;
            int equals = arg.indexOf('=');
            if (arg.startsWith("--") && equals > 0) {
                inlineValue = arg.substring(equals + 1);
                arg = arg.substring(0, equals);
            }

            switch (arg) {
                case "-g", "--group" -> {
                    group = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    if (!ChannelCatalog.isKnown(group)) {
                        throw new RequestParseException("argument " + arg + ": invalid choice: '" + group + "'");
                    }
                }
                case "-s", "--start" -> startDate = parseDate(inlineValue != null ? inlineValue : value(args, ++i, arg), arg);
                case "-e", "--end" -> endDate = parseDate(inlineValue != null ? inlineValue : value(args, ++i, arg), arg);
                case "-d", "--days" -> days = parseDays(inlineValue != null ? inlineValue : value(args, ++i, arg), arg);
                case "-p", "--points" -> points = parsePoints(inlineValue != null ? inlineValue : value(args, ++i, arg), arg);
                case "--view" -> {
                    String option = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    view = MainRoomView.fromOption(option).orElseThrow(() -> new RequestParseException(
                            "argument --view: invalid choice: '" + option + "' (choose from "
                                    + Arrays.stream(MainRoomView.values()).map(MainRoomView::getOption)
                                    .collect(Collectors.joining(", ")) + ")"));
                }
                case "-o", "--output" -> output = Path.of(inlineValue != null ? inlineValue : value(args, ++i, arg));
                case "-a", "--average" -> average = true;
                case "-m", "--max" -> maximum = true;
                case "--clean" -> clean = true;
                default -> throw new RequestParseException("unrecognized argument: " + arg);
            }
        }

        if (average && maximum) {
            throw new RequestParseException("argument -m/--max: not allowed with argument -a/--average");
        }

        Duration span = Duration.ofSeconds(Math.round(days * Duration.ofDays(1).getSeconds()));
        LocalDateTime start;
        LocalDateTime end;
        if (startDate == null) {
            end = endDate != null ? endDate.atStartOfDay() : now;
            start = end.minus(span);
        } else {
            start = startDate.atStartOfDay();
            end = endDate != null ? endDate.atStartOfDay() : start.plus(span);
        }
        if (end.isBefore(start)) {
            throw new RequestParseException("end date " + end.toLocalDate() + " is before start date " + start.toLocalDate());
        }

        return new RequestOptions(group, view, start, end, points, MetricMode.of(average, maximum), clean, output);
    }

    private static String value(List<String> args, int index, String option) {
        if (index >= args.size()) {
            throw new RequestParseException("argument " + option + ": expected one argument");
        }
        return args.get(index);
    }

    private static LocalDate parseDate(String text, String option) {
        String trimmed = text.trim();
        if (!DATE.matcher(trimmed).matches()) {
            throw new RequestParseException("argument " + option + ": not a valid date: '" + text + "'");
        }
        try {
            return LocalDate.parse(trimmed, DATE_FORMATTER);
        } catch (DateTimeParseException ex) {
            throw new RequestParseException("argument " + option + ": not a valid date: '" + text + "'", ex);
        }
    }

    private static double parseDays(String text, String option) {
        String trimmed = text.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            throw new RequestParseException("argument " + option + ": invalid numeric value: '" + text + "'");
        }
        double days = Double.parseDouble(trimmed);
        if (days < MIN_DAYS) {
            throw new RequestParseException("argument " + option + ": number of days must be >= " + MIN_DAYS + "; got " + text);
        }
        return days;
    }

    private static int parsePoints(String text, String option) {
        String trimmed = text.trim();
        if (!INTEGER.matcher(trimmed).matches() || trimmed.length() > 9) {
            throw new RequestParseException("argument " + option + ": invalid int value: '" + text + "'");
        }
        int points = Integer.parseInt(trimmed);
        if (points <= 0) {
            throw new RequestParseException("argument " + option + ": number of points must be positive; got " + text);
        }
        return points;
    }
}
