package org.powerchart.service;

/**
 * Base class for failures that abort a single chart request.
 */
public class PowerDataException extends RuntimeException {

    public PowerDataException(String message) {
        super(message);
    }

    public PowerDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
