package org.powerchart.request;

import org.powerchart.service.PowerDataException;

/**
 * Thrown when command-line options cannot be turned into a request.
 */
public class RequestParseException extends PowerDataException {

    public RequestParseException(String message) {
        super(message);
    }

    public RequestParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
