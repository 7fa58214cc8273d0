package org.powerchart.request;

import org.powerchart.model.MainRoomView;
import org.powerchart.model.MetricMode;
import org.powerchart.model.Request;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Command-line options with resolved date bounds. The group and main-room view may still be
 * missing; the form asks for them.
 */
public record RequestOptions(String group,
                             MainRoomView view,
                             LocalDateTime start,
                             LocalDateTime end,
                             int points,
                             MetricMode mode,
                             boolean plotClean,
                             Path output) {

    public RequestOptions {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(mode, "mode");
    }

    public Optional<String> groupOption() {
        return Optional.ofNullable(group);
    }

    public Optional<MainRoomView> viewOption() {
        return Optional.ofNullable(view);
    }

    public boolean isComplete() {
        return group != null;
    }

    public Request toRequest() {
        if (group == null) {
            throw new RequestParseException("Group name is not specified");
        }
        return toRequest(group, view);
    }

    public Request toRequest(String chosenGroup, MainRoomView chosenView) {
        return new Request(chosenGroup, chosenView, start, end, points, mode, plotClean, output);
    }
}
