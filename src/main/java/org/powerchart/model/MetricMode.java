package org.powerchart.model;

/**
 * Which per-window statistics a request asks for.
 */
public enum MetricMode {
    AVERAGE,
    MAXIMUM,
    BOTH;

    public boolean includesAverage() {
        return this != MAXIMUM;
    }

    public boolean includesMaximum() {
        return this != AVERAGE;
    }

    /**
     * Resolves the two command-line flags; asking for neither means both.
     */
    public static MetricMode of(boolean average, boolean maximum) {
        if (average == maximum) {
            return BOTH;
        }
        return average ? AVERAGE : MAXIMUM;
    }
}
