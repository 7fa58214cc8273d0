package org.powerchart.service;

import org.powerchart.config.AppConfig;
import org.powerchart.model.ChannelCatalog;
import org.powerchart.model.Dataset;
import org.powerchart.model.Request;
import org.powerchart.model.Source;
import org.powerchart.parser.CsvRowReader;
import org.powerchart.parser.LogFileLocator;
import org.powerchart.parser.SourceRow;
import org.powerchart.parser.TimestampParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import java.util.function.ToLongFunction;
import java.util.regex.Pattern;

/**
 * Builds the HPC, UPS and ENT datasets of a request from the log files.
 */
public class PowerLogService {

    private static final Logger log = LoggerFactory.getLogger(PowerLogService.class);

    public static final String UPS_DISCLAIMER = "Missing UPS trendlog for the time period.";
    public static final String ENT_DISCLAIMER = "Missing Enterprise aisle equipment data for the time period.";

    /** First HPC file that carries the annex UPS column. */
    static final LocalDate ANNEX_LOGGED_FROM = LocalDate.of(2024, 2, 16);

    static final String HPC_DATE = "Date";
    static final String UPS_DATE = "Date";
    static final String UPS_TIME = "Time";
    static final String UPS_WATTS = "Watts Out (avg)";
    static final String ENT_TIME = "Time";
    static final String ENT_AMPS = "Value";

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final LogFileLocator locator;
    private final CsvRowReader reader;
    private final ZoneId zone;
    private final double entVoltage;
    private final TimestampParser upsTimestamps;
    private final TimestampParser entTimestamps;

    public PowerLogService(AppConfig config) {
        this(new LogFileLocator(config.getDataDirectory(), config.getUpsPrefix(), config.getEntPrefix()),
                new CsvRowReader(),
                config.getZone(),
                config.getEntVoltage());
    }

    public PowerLogService(LogFileLocator locator, CsvRowReader reader, ZoneId zone, double entVoltage) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.entVoltage = entVoltage;
        this.upsTimestamps = TimestampParser.forUps(zone);
        this.entTimestamps = TimestampParser.forEnterprise(zone);
    }

    /**
     * Reads the HPC polling files of the requested range.
     *
     * <p>For the main room the on-UPS and non-UPS channels are kept separately and their sum is
     * recorded under the group name. A reading missing from a row is recorded as {@code 0} and
     * filled later by the cleaner.</p>
     */
    public Dataset loadHpc(Request request) throws IOException {
        long start = epochSecond(request, true);
        long end = epochSecond(request, false);
        List<Path> files = locator.hpcFiles(request.start().toLocalDate(), request.end().toLocalDate());
        log.info("Parsing HPC data from {} file(s)", files.size());

        Dataset hpc = new Dataset(Source.HPC);
        hpc.declareChannel(request.group());
        if (request.isMainRoom()) {
            hpc.declareChannel(ChannelCatalog.MAIN_ROOM_ON_UPS);
            hpc.declareChannel(ChannelCatalog.MAIN_ROOM_ON_NON_UPS);
            if (request.needsAnnex()) {
                hpc.declareChannel(ChannelCatalog.ANNEX_ON_UPS);
            }
        }

        for (Path file : files) {
            boolean annexLogged = LogFileLocator.fileDate(file)
                    .map(date -> !date.isBefore(ANNEX_LOGGED_FROM))
                    .orElse(false);
            List<SourceRow> rows = reader.read(file);
            hpc.addFile(file);
            log.debug("{}: {} rows", file.getFileName(), rows.size());

            for (SourceRow row : rows) {
                long timestamp = (long) parseNumber(row, HPC_DATE);
                if (timestamp < start || timestamp > end) {
                    continue;
                }
                hpc.addSample(timestamp, hpcValues(row, request, annexLogged));
            }
        }
        log.info("HPC data parsed: {} samples, channels {}", hpc.size(), hpc.getChannelNames());
        return hpc;
    }

    /**
     * Reads the UPS trendlog. Output watts are converted to kW.
     */
    public Dataset loadUps(Request request, List<String> disclaimers) throws IOException {
        log.info("Parsing UPS data");
        return loadTrendLog(Source.UPS, locator.upsFiles(), request, disclaimers, UPS_DISCLAIMER,
                ChannelCatalog.UPS_CHANNEL,
                row -> upsTimestamps.toEpochSecond(row.require(UPS_DATE) + " " + row.require(UPS_TIME)),
                row -> parseNumber(row, UPS_WATTS) / 1000.0);
    }

    /**
     * Reads the enterprise aisle log. Current readings are converted to kW at the configured
     * voltage; unreadable readings become {@code 0}.
     */
    public Dataset loadEnt(Request request, List<String> disclaimers) throws IOException {
        log.info("Parsing ENT data");
        return loadTrendLog(Source.ENT, locator.entFiles(), request, disclaimers, ENT_DISCLAIMER,
                ChannelCatalog.ENT_CHANNEL,
                row -> entTimestamps.toEpochSecond(row.require(ENT_TIME)),
                this::enterpriseKilowatts);
    }

    private Dataset loadTrendLog(Source source,
                                 List<Path> files,
                                 Request request,
                                 List<String> disclaimers,
                                 String disclaimer,
                                 String channel,
                                 ToLongFunction<SourceRow> timestampOf,
                                 ToDoubleFunction<SourceRow> valueOf) throws IOException {
        Dataset dataset = new Dataset(source);
        dataset.declareChannel(channel);
        long start = epochSecond(request, true);
        long end = epochSecond(request, false);

        Optional<Long> lastRecorded = lastRecorded(files, timestampOf);
        if (lastRecorded.isEmpty() || lastRecorded.get() < end) {
            log.warn("{} data ends before {}, channel left empty: {}", source, request.end(), disclaimer);
            disclaimers.add(disclaimer);
            return dataset;
        }

        Long latest = null;
        for (Path file : files) {
            List<SourceRow> rows = reader.read(file);
            dataset.addFile(file);
            Long previousFileEnd = latest;
            for (SourceRow row : rows) {
                long timestamp = timestampOf.applyAsLong(row);
                latest = timestamp;
                if (previousFileEnd != null && previousFileEnd > timestamp) {
                    continue;
                }
                if (timestamp < start || timestamp > end) {
                    continue;
                }
                Map<String, Double> values = new LinkedHashMap<>();
                values.put(channel, valueOf.applyAsDouble(row));
                dataset.addSample(timestamp, values);
            }
            log.debug("{}: {} rows", file.getFileName(), rows.size());
        }
        log.info("{} data parsed: {} samples", source, dataset.size());
        return dataset;
    }

    private Optional<Long> lastRecorded(List<Path> files, ToLongFunction<SourceRow> timestampOf) throws IOException {
        if (files.isEmpty()) {
            return Optional.empty();
        }
        List<SourceRow> rows = reader.read(files.get(files.size() - 1));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(timestampOf.applyAsLong(rows.get(rows.size() - 1)));
    }

    private static Map<String, Double> hpcValues(SourceRow row, Request request, boolean annexLogged) {
        Map<String, Double> values = new LinkedHashMap<>();
        String group = request.group();
        if (request.isMainRoom()) {
            double onUps = parseNumber(row, ChannelCatalog.MAIN_ROOM_ON_UPS);
            double nonUps = parseNumber(row, ChannelCatalog.MAIN_ROOM_ON_NON_UPS);
            values.put(group, onUps + nonUps);
            values.put(ChannelCatalog.MAIN_ROOM_ON_UPS, onUps);
            values.put(ChannelCatalog.MAIN_ROOM_ON_NON_UPS, nonUps);
            if (request.needsAnnex()) {
                boolean present = annexLogged && row.has(ChannelCatalog.ANNEX_ON_UPS);
                values.put(ChannelCatalog.ANNEX_ON_UPS, present ? parseNumber(row, ChannelCatalog.ANNEX_ON_UPS) : 0.0);
            }
        } else {
            values.put(group, row.has(group) ? parseNumber(row, group) : 0.0);
        }
        return values;
    }

    private double enterpriseKilowatts(SourceRow row) {
        String amps = row.field(ENT_AMPS).map(String::trim).orElse("");
        if (!NUMBER.matcher(amps).matches()) {
            return 0.0;
        }
        return entVoltage * Double.parseDouble(amps) / 1000.0;
    }

    private long epochSecond(Request request, boolean start) {
        return (start ? request.start() : request.end()).atZone(zone).toEpochSecond();
    }

    private static double parseNumber(SourceRow row, String column) {
        String value = row.require(column).trim();
        if (value.isEmpty()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Cannot parse '" + value + "' in column '" + column
                    + "' at " + row.location(), ex);
        }
    }
}
