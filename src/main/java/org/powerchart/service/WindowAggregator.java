package org.powerchart.service;

import org.powerchart.correction.CorrectionEntry;
import org.powerchart.correction.CorrectionTable;
import org.powerchart.model.AggregationResult;
import org.powerchart.model.ChannelCatalog;
import org.powerchart.model.Dataset;
import org.powerchart.model.Request;
import org.powerchart.model.Series;
import org.powerchart.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Splits the aligned HPC timeline into equal windows and computes the requested load per window.
 */
public class WindowAggregator {

    private static final Logger log = LoggerFactory.getLogger(WindowAggregator.class);

    private static final DateTimeFormatter LABEL_FORMATTER = DateTimeFormatter.ofPattern("MM/dd-HH:mm", Locale.ROOT);

    private final CorrectionTable corrections;
    private final ZoneId zone;

    public WindowAggregator(CorrectionTable corrections, ZoneId zone) {
        this.corrections = Objects.requireNonNull(corrections, "corrections");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * Computes the per-window statistics of {@code request.group()}.
     *
     * @param hpc         aligned HPC dataset, always required
     * @param ups         aligned UPS dataset, empty when not loaded
     * @param ent         aligned ENT dataset, empty when not loaded
     * @param request     what to compute
     * @param disclaimers availability notes collected while loading
     * @throws InsufficientDataException if the group has fewer samples than windows
     * @throws MissingChannelException  if a combined metric needs an empty UPS or ENT channel
     */
    public AggregationResult aggregate(Dataset hpc,
                                       Dataset ups,
                                       Dataset ent,
                                       Request request,
                                       List<String> disclaimers) {
        String group = request.group();
        int count = request.windowCount();
        int total = hpc.getChannel(group).map(Series::size).orElse(0);
        if (total < count) {
            throw new InsufficientDataException(group, total, count);
        }

        List<Window> windows = Window.partition(total, count);
        Map<String, Double> averages = new LinkedHashMap<>();
        Map<String, Double> maxima = new LinkedHashMap<>();
        WindowSources sources = new WindowSources(hpc, ups, ent);

        for (Window window : windows) {
            long representative = representativeTimestamp(hpc, window);
            String label = label(representative);
            CorrectionEntry correction = corrections.lookup(representative);

            if (request.mode().includesAverage()) {
                averages.put(label, AggregationResult.round(
                        metric(Statistic.AVERAGE, sources, window, correction, request), 2));
            }
            if (request.mode().includesMaximum()) {
                maxima.put(label, AggregationResult.round(
                        metric(Statistic.MAXIMUM, sources, window, correction, request), 2));
            }
        }

        log.info("Aggregated {} samples of '{}' into {} windows of {} samples ({} trailing samples dropped)",
                total, group, count, total / count, total - count * (total / count));
        return new AggregationResult(averages, maxima, disclaimers);
    }

    public String label(long epochSecond) {
        return LABEL_FORMATTER.format(Instant.ofEpochSecond(epochSecond).atZone(zone));
    }

    static long representativeTimestamp(Dataset hpc, Window window) {
        long sum = 0;
        for (int i = window.startOffset(); i < window.endOffset(); i++) {
            sum += hpc.timestampAt(i);
        }
        return (long) Math.rint((double) sum / window.length());
    }

    private static double metric(Statistic statistic,
                                 WindowSources sources,
                                 Window window,
                                 CorrectionEntry correction,
                                 Request request) {
        String group = request.group();
        if (request.isMainRoom()) {
            return mainRoom(statistic, sources, window, correction, request);
        }
        double value = sources.hpc(statistic, group, window);
        if (ChannelCatalog.ANNEX_TOTAL.equals(group)) {
            return correction.annexTotal(value);
        }
        if (ChannelCatalog.ANNEX_ON_UPS.equals(group)) {
            return correction.annexUpsOnly(value);
        }
        return value;
    }

    private static double mainRoom(Statistic statistic,
                                   WindowSources sources,
                                   Window window,
                                   CorrectionEntry correction,
                                   Request request) {
        switch (request.view()) {
            case UPS_ONLY:
                return sources.ups(statistic, window);
            case ENTERPRISE_ONLY:
                return sources.ent(statistic, window);
            case HPC_ONLY:
                return sources.hpc(statistic, ChannelCatalog.MAIN_ROOM_ON_UPS, window)
                        + sources.hpc(statistic, ChannelCatalog.MAIN_ROOM_ON_NON_UPS, window);
            case NONMETERED: {
                double annex = correctedAnnex(statistic, sources, window, correction);
                return sources.ups(statistic, window)
                        - sources.ent(statistic, window)
                        - sources.hpc(statistic, ChannelCatalog.MAIN_ROOM_ON_UPS, window)
                        - annex;
            }
            case WHOLE:
            default: {
                double annex = correctedAnnex(statistic, sources, window, correction);
                return sources.hpc(statistic, ChannelCatalog.MAIN_ROOM_ON_NON_UPS, window)
                        + sources.ups(statistic, window)
                        - annex;
            }
        }
    }

    private static double correctedAnnex(Statistic statistic,
                                         WindowSources sources,
                                         Window window,
                                         CorrectionEntry correction) {
        if (!correction.isAnnexMetered()) {
            return correction.mainRoomAnnexUps(0.0);
        }
        return correction.mainRoomAnnexUps(sources.hpc(statistic, ChannelCatalog.ANNEX_ON_UPS, window));
    }

    private enum Statistic {
        AVERAGE {
            @Override
            double apply(double[] slice) {
                double sum = 0;
                for (double value : slice) {
                    sum += value;
                }
                return sum / slice.length;
            }
        },
        MAXIMUM {
            @Override
            double apply(double[] slice) {
                double max = Double.NEGATIVE_INFINITY;
                for (double value : slice) {
                    max = Math.max(max, value);
                }
                return max;
            }
        };

        abstract double apply(double[] slice);
    }

    private record WindowSources(Dataset hpc, Dataset ups, Dataset ent) {

        double hpc(Statistic statistic, String channel, Window window) {
            return compute(statistic, hpc, channel, window);
        }

        double ups(Statistic statistic, Window window) {
            return compute(statistic, ups, ChannelCatalog.UPS_CHANNEL, window);
        }

        double ent(Statistic statistic, Window window) {
            return compute(statistic, ent, ChannelCatalog.ENT_CHANNEL, window);
        }

        private static double compute(Statistic statistic, Dataset dataset, String channel, Window window) {
            Series series = dataset.getFilledChannel(channel)
                    .orElseThrow(() -> new MissingChannelException(dataset.getSource(), channel));
            if (series.size() < window.endOffset()) {
                throw new AlignmentInvariantException("Channel '" + channel + "' has " + series.size()
                        + " readings, window " + window.index() + " ends at " + window.endOffset());
            }
            double[] slice = series.slice(window.startOffset(), window.endOffset());
            return AggregationResult.round(statistic.apply(slice), 2);
        }
    }
}
