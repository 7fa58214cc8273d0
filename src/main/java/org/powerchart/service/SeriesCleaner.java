package org.powerchart.service;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.powerchart.model.Dataset;
import org.powerchart.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes readings further than one standard deviation from the channel mean and fills the holes.
 *
 * <p>Flagged readings are first replaced by {@code 0}. Every zero is then treated as missing:
 * a leading run copies the first valid value after it, a trailing run copies the last valid
 * value before it, and an interior run takes the midpoint of the valid values around it.
 * Genuine zero readings are filled the same way.</p>
 */
public class SeriesCleaner {

    private static final Logger log = LoggerFactory.getLogger(SeriesCleaner.class);

    static final double FLAG = 0.0;

    public void clean(Dataset dataset) {
        for (Series series : dataset.getChannels()) {
            if (series.isEmpty()) {
                continue;
            }
            int flagged = flagOutliers(series);
            fillFlagged(series);
            log.debug("{} channel '{}': {} of {} readings flagged",
                    dataset.getSource(), series.getChannel(), flagged, series.size());
        }
    }

    private static int flagOutliers(Series series) {
        double[] values = series.toArray();
        double mean = new Mean().evaluate(values);
        double std = new StandardDeviation(false).evaluate(values);

        int flagged = 0;
        for (int i = 0; i < values.length; i++) {
            if (Math.abs(values[i] - mean) > std) {
                series.set(i, FLAG);
                flagged++;
            }
        }
        return flagged;
    }

    static void fillFlagged(Series series) {
        int size = series.size();
        int i = 0;
        while (i < size) {
            if (series.get(i) != FLAG) {
                i++;
                continue;
            }
            int runEnd = i;
            while (runEnd < size && series.get(runEnd) == FLAG) {
                runEnd++;
            }

            double fill;
            if (i == 0 && runEnd == size) {
                fill = FLAG;
            } else if (i == 0) {
                fill = series.get(runEnd);
            } else if (runEnd == size) {
                fill = series.get(i - 1);
            } else {
                fill = (series.get(i - 1) + series.get(runEnd)) / 2;
            }
            for (int j = i; j < runEnd; j++) {
                series.set(j, fill);
            }
            i = runEnd;
        }
    }

    /**
     * Value to insert at {@code index} of a channel that is about to grow by one reading.
     */
    static double fillForInsert(Series series, int index) {
        if (index == 0) {
            return series.get(0);
        }
        if (index >= series.size()) {
            return series.get(series.size() - 1);
        }
        return (series.get(index - 1) + series.get(index)) / 2;
    }
}
