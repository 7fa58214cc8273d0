package org.powerchart.parser;

import org.powerchart.service.PowerDataException;

/**
 * Thrown when a timestamp matches none of the accepted formats.
 */
public class TimestampParseException extends PowerDataException {

    private final String text;

    public TimestampParseException(String text) {
        super("Unrecognized timestamp: '" + text + "'");
        this.text = text;
    }

    public TimestampParseException(String text, Throwable cause) {
        super("Invalid timestamp: '" + text + "'", cause);
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
