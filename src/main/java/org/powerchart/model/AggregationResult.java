package org.powerchart.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Per-window averages and maxima keyed by window label, plus data availability notes.
 */
public class AggregationResult {

    /** Shown in place of a cumulative value that could not be computed. */
    public static final String UNAVAILABLE = "--";

    private final Map<String, Double> averages;
    private final Map<String, Double> maxima;
    private final List<String> disclaimers;

    public AggregationResult(Map<String, Double> averages, Map<String, Double> maxima, List<String> disclaimers) {
        this.averages = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(averages, "averages")));
        this.maxima = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(maxima, "maxima")));
        this.disclaimers = List.copyOf(disclaimers);
    }

    public Map<String, Double> getAverages() {
        return averages;
    }

    public Map<String, Double> getMaxima() {
        return maxima;
    }

    public List<String> getDisclaimers() {
        return disclaimers;
    }

    /**
     * Mean of the window averages, rounded to three decimals.
     */
    public OptionalDouble cumulativeAverage() {
        if (averages.isEmpty()) {
            return OptionalDouble.empty();
        }
        double mean = averages.values().stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        return OptionalDouble.of(round(mean, 3));
    }

    /**
     * Largest window maximum, rounded to three decimals.
     */
    public OptionalDouble cumulativeMaximum() {
        if (maxima.isEmpty()) {
            return OptionalDouble.empty();
        }
        double max = maxima.values().stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        return OptionalDouble.of(round(max, 3));
    }

    public String formatCumulativeAverage() {
        return format(cumulativeAverage());
    }

    public String formatCumulativeMaximum() {
        return format(cumulativeMaximum());
    }

    public String summary() {
        return "Cumulative Average: " + formatCumulativeAverage()
                + " kW   Cumulative Max: " + formatCumulativeMaximum() + " kW";
    }

    public boolean isEmpty() {
        return averages.isEmpty() && maxima.isEmpty();
    }

    /**
     * Rounds the exact binary value of {@code value}, so {@code round(2.675, 2)} is {@code 2.67}.
     */
    public static double round(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static String format(OptionalDouble value) {
        return value.isPresent() ? BigDecimal.valueOf(value.getAsDouble()).stripTrailingZeros().toPlainString() : UNAVAILABLE;
    }
}
