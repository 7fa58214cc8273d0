package org.powerchart.service;

import org.powerchart.model.Source;

/**
 * Thrown when a combined metric needs a channel whose source has no data for the request.
 */
public class MissingChannelException extends PowerDataException {

    private final Source source;
    private final String channel;

    public MissingChannelException(Source source, String channel) {
        super("No " + source.getDisplayName() + " data available for channel '" + channel + "'");
        this.source = source;
        this.channel = channel;
    }

    public Source getSource() {
        return source;
    }

    public String getChannel() {
        return channel;
    }
}
