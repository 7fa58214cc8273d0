package org.powerchart.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Readings of one source: a shared timeline plus named channels.
 *
 * <p>Every non-empty channel holds exactly one value per timeline entry. Channels that are
 * declared but never filled stay empty and are ignored by cleaning and alignment.</p>
 */
public class Dataset {

    private final Source source;
    private final Map<String, Series> channels = new LinkedHashMap<>();
    private final List<Path> files = new ArrayList<>();
    private List<Long> timeline = new ArrayList<>();

    public Dataset(Source source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public Source getSource() {
        return source;
    }

    /**
     * Declares a channel so that it exists even if no value is ever recorded.
     */
    public Series declareChannel(String channel) {
        return channels.computeIfAbsent(channel, Series::new);
    }

    /**
     * Appends one row: a timestamp and the values recorded for it.
     */
    public void addSample(long timestamp, Map<String, Double> values) {
        Objects.requireNonNull(values, "values");
        timeline.add(timestamp);
        values.forEach((channel, value) -> declareChannel(channel).add(value));
    }

    public List<Long> getTimeline() {
        return Collections.unmodifiableList(timeline);
    }

    public long timestampAt(int index) {
        return timeline.get(index);
    }

    public void setTimestamp(int index, long timestamp) {
        timeline.set(index, timestamp);
    }

    public void insertTimestamp(int index, long timestamp) {
        timeline.add(index, timestamp);
    }

    public void replaceTimeline(List<Long> newTimeline) {
        Objects.requireNonNull(newTimeline, "newTimeline");
        timeline = new ArrayList<>(newTimeline);
    }

    public Collection<Series> getChannels() {
        return channels.values();
    }

    public Set<String> getChannelNames() {
        return Collections.unmodifiableSet(channels.keySet());
    }

    public Optional<Series> getChannel(String channel) {
        return Optional.ofNullable(channels.get(channel));
    }

    /**
     * Returns the channel only if it carries data.
     */
    public Optional<Series> getFilledChannel(String channel) {
        return getChannel(channel).filter(series -> !series.isEmpty());
    }

    public int size() {
        return timeline.size();
    }

    public boolean isEmpty() {
        return timeline.isEmpty();
    }

    public void addFile(Path file) {
        files.add(file);
    }

    public List<Path> getFiles() {
        return Collections.unmodifiableList(files);
    }
}
