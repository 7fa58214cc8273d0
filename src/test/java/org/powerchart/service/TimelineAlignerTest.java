package org.powerchart.service;

import org.junit.jupiter.api.Test;
import org.powerchart.model.ChannelCatalog;
import org.powerchart.model.Dataset;
import org.powerchart.model.Source;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimelineAlignerTest {

    private static final long BASE = 1_704_067_200L;

    private final TimelineAligner aligner = new TimelineAligner();

    @Test
    void copiesTimelineWhenLengthsMatch() {
        Dataset hpc = dataset(Source.HPC, "PDU-A4-1", 0, 10);
        Dataset ups = dataset(Source.UPS, ChannelCatalog.UPS_CHANNEL, 5, 10);

        AlignmentReport report = aligner.align(hpc, ups);

        assertFalse(report.resized());
        assertEquals(0, report.inserted());
        assertEquals(ups.getTimeline(), hpc.getTimeline());
        assertEquals(10, hpc.getChannel("PDU-A4-1").orElseThrow().size());
    }

    @Test
    void fillsGapInShorterDatasetAtTheGap() {
        Dataset hpc = dataset(Source.HPC, "PDU-A4-1", 0, 100);
        Dataset ups = new Dataset(Source.UPS);
        for (int i = 0; i < 100; i++) {
            if (i >= 40 && i < 45) {
                continue;
            }
            ups.addSample(BASE + i * 60L, Map.of(ChannelCatalog.UPS_CHANNEL, (double) i));
        }

        AlignmentReport report = aligner.align(hpc, ups);

        assertTrue(report.resized());
        assertEquals(5, report.inserted());
        assertEquals(95, report.snapped());
        assertEquals(hpc.getTimeline(), ups.getTimeline());
        List<Double> values = ups.getChannel(ChannelCatalog.UPS_CHANNEL).orElseThrow().getValues();
        assertEquals(100, values.size());
        assertEquals(39.0, values.get(39));
        for (int i = 40; i < 45; i++) {
            assertTrue(values.get(i) > 39.0 && values.get(i) < 45.0, "inserted reading at " + i);
        }
        assertEquals(42.0, values.get(40));
        assertEquals(45.0, values.get(45));
        assertEquals(99.0, values.get(99));
    }

    @Test
    void rejectsShorterTimelineThatStopsEarly() {
        Dataset hpc = dataset(Source.HPC, "PDU-A4-1", 0, 100);
        Dataset ups = new Dataset(Source.UPS);
        for (int i = 0; i < 50; i++) {
            ups.addSample(BASE + i * 60L, Map.of(ChannelCatalog.UPS_CHANNEL, 10.0 + i));
        }

        assertThrows(AlignmentInvariantException.class, () -> aligner.align(hpc, ups));
    }

    @Test
    void padsSingleMissingTrailingSample() {
        Dataset hpc = dataset(Source.HPC, "PDU-A4-1", 0, 10);
        Dataset ups = dataset(Source.UPS, ChannelCatalog.UPS_CHANNEL, 0, 9);

        AlignmentReport report = aligner.align(hpc, ups);

        assertEquals(1, report.inserted());
        assertEquals(hpc.getTimeline(), ups.getTimeline());
        assertEquals(9.0, ups.getChannel(ChannelCatalog.UPS_CHANNEL).orElseThrow().get(9));
    }

    @Test
    void reportsForwardSkipInLongerTimeline() {
        Dataset hpc = new Dataset(Source.HPC);
        for (int i = 0; i < 10; i++) {
            long timestamp = BASE + i * 60L + (i >= 5 ? 3000L : 0L);
            hpc.addSample(timestamp, Map.of("PDU-A4-1", 1.0));
        }
        Dataset ups = dataset(Source.UPS, ChannelCatalog.UPS_CHANNEL, 0, 9);

        AlignmentDriftException ex = assertThrows(AlignmentDriftException.class, () -> aligner.align(hpc, ups));

        assertEquals(5, ex.getIndex());
        assertEquals(BASE + 300L, ex.getShorterTimestamp());
        assertEquals(BASE + 3300L, ex.getLongerTimestamp());
    }

    @Test
    void skipsSourcesWithoutData() {
        Dataset hpc = dataset(Source.HPC, "PDU-A4-1", 0, 10);
        Dataset ups = dataset(Source.UPS, ChannelCatalog.UPS_CHANNEL, 5, 10);

        aligner.align(hpc, ups, new Dataset(Source.ENT));

        assertEquals(ups.getTimeline(), hpc.getTimeline());
    }

    @Test
    void rejectsSourcesThatEndOnDifferentTimelines() {
        Dataset hpc = dataset(Source.HPC, "PDU-A4-1", 0, 10);
        Dataset ups = dataset(Source.UPS, ChannelCatalog.UPS_CHANNEL, 5, 10);
        Dataset ent = dataset(Source.ENT, ChannelCatalog.ENT_CHANNEL, 10, 10);

        assertThrows(AlignmentInvariantException.class, () -> aligner.align(hpc, ups, ent));
    }

    private static Dataset dataset(Source source, String channel, long offset, int samples) {
        Dataset dataset = new Dataset(source);
        for (int i = 0; i < samples; i++) {
            dataset.addSample(BASE + offset + i * 60L, Map.of(channel, 1.0 + i));
        }
        return dataset;
    }
}
