package org.powerchart.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Holds all readings for a particular channel of a dataset.
 */
public class Series {

    private final String channel;
    private final List<Double> values = new ArrayList<>();

    public Series(String channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public String getChannel() {
        return channel;
    }

    public List<Double> getValues() {
        return Collections.unmodifiableList(values);
    }

    public double get(int index) {
        return values.get(index);
    }

    public void set(int index, double value) {
        values.set(index, value);
    }

    public void add(double value) {
        values.add(value);
    }

    public void insert(int index, double value) {
        values.add(index, value);
    }

    /**
     * Copies the values of {@code [from, to)} into a primitive array.
     */
    public double[] slice(int from, int to) {
        double[] result = new double[to - from];
        for (int i = from; i < to; i++) {
            result[i - from] = values.get(i);
        }
        return result;
    }

    public double[] toArray() {
        return slice(0, values.size());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
