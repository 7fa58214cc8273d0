package org.powerchart.service;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.powerchart.model.Dataset;
import org.powerchart.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reconciles the timelines of two datasets sampled independently.
 *
 * <p>When both timelines have the same length the secondary timeline is copied over the
 * primary one. Otherwise the shorter dataset is resized to the longer timeline: readings
 * that drifted within tolerance are snapped, every missing interval gets an interpolated reading
 * at its own position, and a forward skip in the longer timeline is reported as
 * {@link AlignmentDriftException}. A shorter timeline that stops more than one sampling step
 * before the longer one is reported as {@link AlignmentInvariantException}.</p>
 */
public class TimelineAligner {

    private static final Logger log = LoggerFactory.getLogger(TimelineAligner.class);

    /**
     * Aligns HPC against UPS and then against ENT, skipping sources without data.
     *
     * @throws AlignmentInvariantException if HPC does not end up on the same timeline as both
     */
    public void align(Dataset hpc, Dataset ups, Dataset ent) {
        if (!ups.isEmpty()) {
            AlignmentReport report = align(hpc, ups);
            log.info("Aligned HPC with UPS: {}", report);
        }
        if (!ent.isEmpty()) {
            AlignmentReport report = align(hpc, ent);
            log.info("Aligned HPC with ENT: {}", report);
        }

        if (!ups.isEmpty() && !hpc.getTimeline().equals(ups.getTimeline())) {
            throw new AlignmentInvariantException("HPC and UPS timelines differ after alignment");
        }
        if (!ent.isEmpty() && !hpc.getTimeline().equals(ent.getTimeline())) {
            throw new AlignmentInvariantException("HPC and ENT timelines differ after alignment");
        }
    }

    public AlignmentReport align(Dataset primary, Dataset secondary) {
        if (primary.size() == secondary.size()) {
            primary.replaceTimeline(secondary.getTimeline());
            return new AlignmentReport(false, 0, 0);
        }

        Dataset shorter = primary.size() < secondary.size() ? primary : secondary;
        Dataset longer = shorter == primary ? secondary : primary;
        List<Long> reference = longer.getTimeline();

        if (shorter.isEmpty()) {
            throw new AlignmentInvariantException(shorter.getSource() + " has no timestamps to align");
        }

        double stdDiff = prefixDifferenceDeviation(reference, shorter.getTimeline());
        double tolerance = Math.abs(stdDiff);
        double threshold = stdDiff + tolerance;
        log.debug("{} vs {}: deviation of timestamp difference {} s, tolerance {} s",
                longer.getSource(), shorter.getSource(), stdDiff, tolerance);

        int inserted = 0;
        int snapped = 0;
        long offset = 0;
        long lastSnapped = reference.get(0);
        for (int i = 0; i < reference.size(); i++) {
            long elem2 = reference.get(i);
            if (i >= shorter.size()) {
                long spacing = i > 0 ? elem2 - reference.get(i - 1) : 0;
                if (elem2 - lastSnapped > Math.max(threshold, spacing)) {
                    throw new AlignmentInvariantException(shorter.getSource() + " ends at " + lastSnapped
                            + ", " + longer.getSource() + " continues to " + reference.get(reference.size() - 1));
                }
                insert(shorter, i, elem2);
                inserted++;
                continue;
            }

            long elem1 = shorter.timestampAt(i);
            if (elem2 - elem1 > threshold) {
                throw new AlignmentDriftException(i, elem1, elem2, threshold);
            }
            boolean gap = elem1 - elem2 > threshold
                    || (i + 1 < reference.size() && closerToNext(elem1 - offset, elem2, reference.get(i + 1)));
            if (gap) {
                log.debug("Gap in {} at index {}: {} > {}", shorter.getSource(), i, elem1, elem2);
                insert(shorter, i, elem2);
                inserted++;
            } else {
                offset = elem1 - elem2;
                if (elem1 != elem2) {
                    shorter.setTimestamp(i, elem2);
                }
                lastSnapped = elem2;
                snapped++;
            }
        }

        verify(shorter, longer);
        return new AlignmentReport(true, inserted, snapped);
    }

    /**
     * Whether a reading, shifted back by the offset seen at the last match, sits nearer the next
     * reference timestamp than the current one.
     */
    private static boolean closerToNext(long adjusted, long current, long next) {
        return Math.abs(adjusted - next) < Math.abs(adjusted - current);
    }

    private static double prefixDifferenceDeviation(List<Long> longer, List<Long> shorter) {
        double[] differences = new double[shorter.size()];
        for (int i = 0; i < differences.length; i++) {
            differences[i] = longer.get(i) - shorter.get(i);
        }
        if (differences.length == 0) {
            return 0.0;
        }
        return new StandardDeviation(false).evaluate(differences);
    }

    private static void insert(Dataset dataset, int index, long timestamp) {
        for (Series series : dataset.getChannels()) {
            if (series.isEmpty()) {
                continue;
            }
            series.insert(index, SeriesCleaner.fillForInsert(series, index));
        }
        dataset.insertTimestamp(index, timestamp);
    }

    private static void verify(Dataset shorter, Dataset longer) {
        int size = longer.size();
        if (shorter.size() != size) {
            throw new AlignmentInvariantException(shorter.getSource() + " has " + shorter.size()
                    + " timestamps after alignment, " + longer.getSource() + " has " + size);
        }
        if (size > 0 && shorter.timestampAt(size / 2) != longer.timestampAt(size / 2)) {
            throw new AlignmentInvariantException("Midpoint timestamps differ after alignment: "
                    + shorter.timestampAt(size / 2) + " vs " + longer.timestampAt(size / 2));
        }
        for (Series series : shorter.getChannels()) {
            if (!series.isEmpty() && series.size() != size) {
                throw new AlignmentInvariantException("Channel '" + series.getChannel() + "' has "
                        + series.size() + " readings for " + size + " timestamps");
            }
        }
    }
}
