package org.powerchart.service;

import org.junit.jupiter.api.Test;
import org.powerchart.correction.CorrectionTable;
import org.powerchart.model.AggregationResult;
import org.powerchart.model.ChannelCatalog;
import org.powerchart.model.Dataset;
import org.powerchart.model.MainRoomView;
import org.powerchart.model.MetricMode;
import org.powerchart.model.Request;
import org.powerchart.model.Source;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertIterableEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowAggregatorTest {

    private static final long JAN_1_2024 = 1_704_067_200L;
    private static final String PDU = "PDU-A4-1";

    private final WindowAggregator aggregator = new WindowAggregator(CorrectionTable.standard(), ZoneOffset.UTC);

    @Test
    void averagesEachWindowOfSingleChannel() {
        Dataset hpc = new Dataset(Source.HPC);
        for (int i = 0; i < 400; i++) {
            hpc.addSample(JAN_1_2024 + i * 60L, Map.of(PDU, (double) (i / 100 + 1)));
        }

        AggregationResult result = aggregate(hpc, request(PDU, null, 4, MetricMode.BOTH));

        assertIterableEquals(List.of("01/01-00:49", "01/01-02:29", "01/01-04:09", "01/01-05:49"),
                result.getAverages().keySet());
        assertIterableEquals(List.of(1.0, 2.0, 3.0, 4.0), result.getAverages().values());
        assertIterableEquals(List.of(1.0, 2.0, 3.0, 4.0), result.getMaxima().values());
        assertEquals("2.5", result.formatCumulativeAverage());
        assertEquals("4", result.formatCumulativeMaximum());
    }

    @Test
    void dropsTrailingSamples() {
        Dataset hpc = new Dataset(Source.HPC);
        for (int i = 0; i < 403; i++) {
            hpc.addSample(JAN_1_2024 + i * 60L, Map.of(PDU, i < 400 ? 5.0 : 1000.0));
        }

        AggregationResult result = aggregate(hpc, request(PDU, null, 4, MetricMode.MAXIMUM));

        assertEquals(4, result.getMaxima().size());
        assertTrue(result.getMaxima().values().stream().allMatch(value -> value == 5.0));
        assertTrue(result.getAverages().isEmpty());
        assertEquals(AggregationResult.UNAVAILABLE, result.formatCumulativeAverage());
    }

    @Test
    void rejectsMoreWindowsThanSamples() {
        Dataset hpc = new Dataset(Source.HPC);
        for (int i = 0; i < 3; i++) {
            hpc.addSample(JAN_1_2024 + i * 60L, Map.of(PDU, 1.0));
        }

        InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> aggregate(hpc, request(PDU, null, 4, MetricMode.BOTH)));

        assertEquals(3, ex.getAvailable());
        assertEquals(4, ex.getRequested());
    }

    @Test
    void subtractsBaselineAnnexBeforeMetering() {
        long start = CorrectionTable.ANNEX_METERED_FROM - 100_000L;

        AggregationResult result = aggregateMainRoom(start, MainRoomView.WHOLE);

        assertEquals(53.14, result.getAverages().values().iterator().next());
    }

    @Test
    void addsMeteredAnnexAndConstantsAfterCutover() {
        long start = CorrectionTable.ANNEX_METERED_FROM + 1_000L;

        AggregationResult result = aggregateMainRoom(start, MainRoomView.WHOLE);

        // 10 + 50 - (3 + SCGP 1.248 + A0-3 0.794)
        assertEquals(54.96, result.getAverages().values().iterator().next());
    }

    @Test
    void keepsRackConstantAfterSecondCutover() {
        long start = CorrectionTable.PDU_A03_METERED_FROM + 1_000L;

        AggregationResult result = aggregateMainRoom(start, MainRoomView.WHOLE);

        // 10 + 50 - (3 + SCGP 1.248)
        assertEquals(55.75, result.getAverages().values().iterator().next());
    }

    @Test
    void hpcOnlyViewSumsMeteredFeeds() {
        AggregationResult result = aggregateMainRoom(JAN_1_2024, MainRoomView.HPC_ONLY);

        assertEquals(30.0, result.getAverages().values().iterator().next());
    }

    @Test
    void switchesCorrectionAtFirstWindowPastCutover() {
        long start = CorrectionTable.ANNEX_METERED_FROM - 1_200L;

        AggregationResult result = aggregateMainRoom(start, MainRoomView.WHOLE, 40, 4);

        assertIterableEquals(List.of(53.14, 53.14, 54.96, 54.96), result.getAverages().values());
    }

    @Test
    void hpcOnlyViewAveragesFeedsPerWindow() {
        Dataset hpc = new Dataset(Source.HPC);
        for (int i = 0; i < 400; i++) {
            hpc.addSample(JAN_1_2024 + i * 60L, Map.of(
                    ChannelCatalog.MAIN_ROOM, i + 1.0,
                    ChannelCatalog.MAIN_ROOM_ON_UPS, (double) i,
                    ChannelCatalog.MAIN_ROOM_ON_NON_UPS, 1.0));
        }

        AggregationResult result = aggregate(hpc,
                request(ChannelCatalog.MAIN_ROOM, MainRoomView.HPC_ONLY, 4, MetricMode.BOTH));

        assertIterableEquals(List.of(50.5, 150.5, 250.5, 350.5), result.getAverages().values());
        assertIterableEquals(List.of(100.0, 200.0, 300.0, 400.0), result.getMaxima().values());
    }

    @Test
    void enterpriseViewChartsAisleFeed() {
        AggregationResult result = aggregateMainRoom(JAN_1_2024, MainRoomView.ENTERPRISE_ONLY);

        assertEquals(8.0, result.getAverages().values().iterator().next());
    }

    @Test
    void nonmeteredViewSubtractsEveryMeteredLoadFromUps() {
        long start = CorrectionTable.ANNEX_METERED_FROM - 100_000L;

        AggregationResult result = aggregateMainRoom(start, MainRoomView.NONMETERED);

        // 50 - 8 - 20 - baseline 6.857
        assertEquals(15.14, result.getAverages().values().iterator().next());
    }

    @Test
    void nonmeteredViewCombinesPerChannelMaxima() {
        long start = CorrectionTable.ANNEX_METERED_FROM + 1_000L;
        Dataset hpc = new Dataset(Source.HPC);
        Dataset ups = new Dataset(Source.UPS);
        Dataset ent = new Dataset(Source.ENT);
        for (int i = 0; i < 10; i++) {
            boolean high = i % 2 == 1;
            long timestamp = start + i * 60L;
            hpc.addSample(timestamp, Map.of(
                    ChannelCatalog.MAIN_ROOM, high ? 35.0 : 30.0,
                    ChannelCatalog.MAIN_ROOM_ON_UPS, high ? 25.0 : 20.0,
                    ChannelCatalog.MAIN_ROOM_ON_NON_UPS, 10.0,
                    ChannelCatalog.ANNEX_ON_UPS, high ? 4.0 : 3.0));
            ups.addSample(timestamp, Map.of(ChannelCatalog.UPS_CHANNEL, high ? 60.0 : 50.0));
            ent.addSample(timestamp, Map.of(ChannelCatalog.ENT_CHANNEL, high ? 9.0 : 8.0));
        }

        AggregationResult result = aggregator.aggregate(hpc, ups, ent,
                request(ChannelCatalog.MAIN_ROOM, MainRoomView.NONMETERED, 1, MetricMode.BOTH), new ArrayList<>());

        // 55 - 8.5 - 22.5 - (3.5 + SCGP 1.248 + A0-3 0.794)
        assertEquals(18.46, result.getAverages().values().iterator().next());
        // 60 - 9 - 25 - (4 + SCGP 1.248 + A0-3 0.794)
        assertEquals(19.96, result.getMaxima().values().iterator().next());
    }

    @Test
    void annexOnUpsUsesBaselineBeforeMetering() {
        AggregationResult result = aggregateAnnexOnUps(CorrectionTable.ANNEX_METERED_FROM - 100_000L);

        assertEquals(6.86, result.getAverages().values().iterator().next());
    }

    @Test
    void annexOnUpsAddsRackConstantBetweenCutovers() {
        AggregationResult result = aggregateAnnexOnUps(CorrectionTable.ANNEX_METERED_FROM + 1_000L);

        // 3 + A0-3 0.794
        assertEquals(3.79, result.getAverages().values().iterator().next());
    }

    @Test
    void annexOnUpsIsRawOnceRackIsMetered() {
        AggregationResult result = aggregateAnnexOnUps(CorrectionTable.PDU_A03_METERED_FROM + 1_000L);

        assertEquals(3.0, result.getAverages().values().iterator().next());
    }

    @Test
    void failsWhenCombinedMetricLacksUpsData() {
        Dataset hpc = mainRoomHpc(JAN_1_2024);

        MissingChannelException ex = assertThrows(MissingChannelException.class,
                () -> aggregator.aggregate(hpc, new Dataset(Source.UPS), new Dataset(Source.ENT),
                        request(ChannelCatalog.MAIN_ROOM, MainRoomView.WHOLE, 1, MetricMode.AVERAGE),
                        new ArrayList<>()));

        assertEquals(Source.UPS, ex.getSource());
        assertEquals(ChannelCatalog.UPS_CHANNEL, ex.getChannel());
    }

    @Test
    void annexTotalAddsConstantsAfterCutover() {
        Dataset hpc = new Dataset(Source.HPC);
        long start = CorrectionTable.ANNEX_METERED_FROM + 1_000L;
        for (int i = 0; i < 10; i++) {
            hpc.addSample(start + i * 60L, Map.of(ChannelCatalog.ANNEX_TOTAL, 10.0));
        }

        AggregationResult result = aggregate(hpc, request(ChannelCatalog.ANNEX_TOTAL, null, 1, MetricMode.AVERAGE));

        // 10 + A0-3 0.794 + non-UPS 2.047 + SCGP 1.248
        assertEquals(14.09, result.getAverages().values().iterator().next());
    }

    @Test
    void carriesDisclaimersIntoResult() {
        Dataset hpc = new Dataset(Source.HPC);
        for (int i = 0; i < 4; i++) {
            hpc.addSample(JAN_1_2024 + i * 60L, Map.of(PDU, 1.0));
        }

        AggregationResult result = aggregator.aggregate(hpc, new Dataset(Source.UPS), new Dataset(Source.ENT),
                request(PDU, null, 2, MetricMode.BOTH), List.of(PowerLogService.UPS_DISCLAIMER));

        assertEquals(List.of(PowerLogService.UPS_DISCLAIMER), result.getDisclaimers());
    }

    private AggregationResult aggregate(Dataset hpc, Request request) {
        return aggregator.aggregate(hpc, new Dataset(Source.UPS), new Dataset(Source.ENT), request, new ArrayList<>());
    }

    private AggregationResult aggregateAnnexOnUps(long start) {
        Dataset hpc = new Dataset(Source.HPC);
        for (int i = 0; i < 10; i++) {
            hpc.addSample(start + i * 60L, Map.of(ChannelCatalog.ANNEX_ON_UPS, 3.0));
        }
        return aggregate(hpc, request(ChannelCatalog.ANNEX_ON_UPS, null, 1, MetricMode.AVERAGE));
    }

    private AggregationResult aggregateMainRoom(long start, MainRoomView view) {
        return aggregateMainRoom(start, view, 10, 1);
    }

    private AggregationResult aggregateMainRoom(long start, MainRoomView view, int samples, int windows) {
        Dataset hpc = mainRoomHpc(start, samples);
        Dataset ups = new Dataset(Source.UPS);
        Dataset ent = new Dataset(Source.ENT);
        for (int i = 0; i < samples; i++) {
            ups.addSample(start + i * 60L, Map.of(ChannelCatalog.UPS_CHANNEL, 50.0));
            ent.addSample(start + i * 60L, Map.of(ChannelCatalog.ENT_CHANNEL, 8.0));
        }
        return aggregator.aggregate(hpc, ups, ent,
                request(ChannelCatalog.MAIN_ROOM, view, windows, MetricMode.AVERAGE), new ArrayList<>());
    }

    private static Dataset mainRoomHpc(long start) {
        return mainRoomHpc(start, 10);
    }

    private static Dataset mainRoomHpc(long start, int samples) {
        Dataset hpc = new Dataset(Source.HPC);
        for (int i = 0; i < samples; i++) {
            hpc.addSample(start + i * 60L, Map.of(
                    ChannelCatalog.MAIN_ROOM, 30.0,
                    ChannelCatalog.MAIN_ROOM_ON_UPS, 20.0,
                    ChannelCatalog.MAIN_ROOM_ON_NON_UPS, 10.0,
                    ChannelCatalog.ANNEX_ON_UPS, 3.0));
        }
        return hpc;
    }

    private static Request request(String group, MainRoomView view, int windows, MetricMode mode) {
        return new Request(group, view,
                LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 1, 2, 0, 0),
                windows, mode, false, null);
    }
}
