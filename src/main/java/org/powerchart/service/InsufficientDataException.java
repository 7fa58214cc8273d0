package org.powerchart.service;

/**
 * Thrown when a channel has fewer samples than the number of requested windows.
 */
public class InsufficientDataException extends PowerDataException {

    private final int available;
    private final int requested;

    public InsufficientDataException(String channel, int available, int requested) {
        super("Cannot have more points than there are data: channel '" + channel + "' has "
                + available + " samples, " + requested + " points requested");
        this.available = available;
        this.requested = requested;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequested() {
        return requested;
    }
}
