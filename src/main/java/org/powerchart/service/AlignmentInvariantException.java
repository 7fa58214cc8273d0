package org.powerchart.service;

/**
 * Thrown when two timelines still disagree after alignment.
 */
public class AlignmentInvariantException extends PowerDataException {

    public AlignmentInvariantException(String message) {
        super(message);
    }
}
