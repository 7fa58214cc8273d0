package org.powerchart.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A contiguous slice {@code [startOffset, endOffset)} of a dataset's sample index range.
 */
public record Window(int index, int startOffset, int endOffset) {

    public int length() {
        return endOffset - startOffset;
    }

    /**
     * Splits {@code totalSamples} into {@code count} equal windows of
     * {@code totalSamples / count} samples. Samples past the last window are not covered.
     */
    public static List<Window> partition(int totalSamples, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("window count must be positive: " + count);
        }
        int interval = totalSamples / count;
        List<Window> windows = new ArrayList<>(count);
        for (int x = 0; x < count; x++) {
            windows.add(new Window(x, x * interval, (x + 1) * interval));
        }
        return windows;
    }
}
