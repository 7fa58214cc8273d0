package org.powerchart.service;

/**
 * Outcome of aligning one pair of datasets.
 *
 * @param resized  whether the timelines had different lengths
 * @param inserted readings added to the shorter dataset
 * @param snapped  timestamps of the shorter dataset moved onto the longer timeline
 */
public record AlignmentReport(boolean resized, int inserted, int snapped) {
}
