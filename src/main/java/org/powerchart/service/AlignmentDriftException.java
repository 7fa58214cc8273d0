package org.powerchart.service;

/**
 * Thrown when the longer timeline jumps ahead of the shorter one by more than the drift tolerance.
 */
public class AlignmentDriftException extends PowerDataException {

    private final int index;
    private final long shorterTimestamp;
    private final long longerTimestamp;

    public AlignmentDriftException(int index, long shorterTimestamp, long longerTimestamp, double threshold) {
        super("Skip in timestamps at index " + index + ": " + longerTimestamp + " is ahead of "
                + shorterTimestamp + " by more than " + threshold + " s");
        this.index = index;
        this.shorterTimestamp = shorterTimestamp;
        this.longerTimestamp = longerTimestamp;
    }

    public int getIndex() {
        return index;
    }

    public long getShorterTimestamp() {
        return shorterTimestamp;
    }

    public long getLongerTimestamp() {
        return longerTimestamp;
    }
}
