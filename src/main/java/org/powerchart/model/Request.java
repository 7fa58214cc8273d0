package org.powerchart.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully resolved chart request. Every pipeline stage receives it by parameter.
 *
 * @param group       channel (or main-room aggregate) to chart
 * @param view        main-room section; ignored for other groups
 * @param start       first instant included
 * @param end         last instant included
 * @param windowCount number of plotted points
 * @param mode        statistics to compute
 * @param plotClean   whether per-point value labels are omitted
 * @param output      PNG file written after rendering, may be {@code null}
 */
public record Request(String group,
                      MainRoomView view,
                      LocalDateTime start,
                      LocalDateTime end,
                      int windowCount,
                      MetricMode mode,
                      boolean plotClean,
                      Path output) {

    public Request {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(mode, "mode");
        view = view == null ? MainRoomView.WHOLE : view;
        if (windowCount <= 0) {
            throw new IllegalArgumentException("windowCount must be positive: " + windowCount);
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    public boolean isMainRoom() {
        return ChannelCatalog.isMainRoom(group);
    }

    public boolean needsUps() {
        return isMainRoom() && view.needsUps();
    }

    public boolean needsEnterprise() {
        return isMainRoom() && view.needsEnterprise();
    }

    public boolean needsAnnex() {
        return isMainRoom() && view.needsAnnex();
    }

    /**
     * Whole calendar days between the start and end dates.
     */
    public long numDays() {
        return ChronoUnit.DAYS.between(start.toLocalDate(), end.toLocalDate());
    }

    public Optional<Path> outputFile() {
        return Optional.ofNullable(output);
    }

    public String title() {
        String title = "Power Data for " + group;
        return isMainRoom() ? title + " " + view.getHeader() : title;
    }
}
