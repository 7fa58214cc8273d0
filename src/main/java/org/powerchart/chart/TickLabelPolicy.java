package org.powerchart.chart;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which window labels are printed under the x axis.
 *
 * <p>Labels have the {@code MM/dd-HH:mm} layout. Hidden labels are returned as empty strings
 * so the result stays index-aligned with the input.</p>
 */
public final class TickLabelPolicy {

    static final int SHORT_RANGE_DAYS = 5;
    static final int DENSE_POINTS = 26;
    static final int LONG_RANGE_DAYS = 21;
    static final int TARGET_TICKS = 12;

    private static final int DAY_PREFIX = 5;

    private TickLabelPolicy() {
    }

    public static List<String> visibleLabels(List<String> labels, long numDays, int points) {
        List<String> visible = new ArrayList<>(labels.size());
        if (numDays < SHORT_RANGE_DAYS) {
            int interval = points < DENSE_POINTS ? 2 : ceilDiv(points, TARGET_TICKS);
            for (int i = 0; i < labels.size(); i++) {
                visible.add(i % interval == 0 ? labels.get(i) : "");
            }
            return visible;
        }

        int interval = numDays > LONG_RANGE_DAYS ? (int) ceilDiv(numDays, TARGET_TICKS) : 1;
        int newDays = 1;
        for (int i = 0; i < labels.size(); i++) {
            String day = dayOf(labels.get(i));
            if (i == 0) {
                visible.add(day);
            } else if (day.equals(dayOf(labels.get(i - 1)))) {
                visible.add("");
            } else {
                visible.add(newDays % interval == 0 ? day : "");
                newDays++;
            }
        }
        return visible;
    }

    private static String dayOf(String label) {
        return label.length() > DAY_PREFIX ? label.substring(0, DAY_PREFIX) : label;
    }

    private static long ceilDiv(long value, long divisor) {
        return (value + divisor - 1) / divisor;
    }

    private static int ceilDiv(int value, int divisor) {
        return (value + divisor - 1) / divisor;
    }
}
