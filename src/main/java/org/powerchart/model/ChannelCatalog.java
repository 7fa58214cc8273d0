package org.powerchart.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Channel names known to the HPC polling logs, grouped the way they are offered for selection.
 */
public final class ChannelCatalog {

    public static final String MAIN_ROOM = "Com Center Main Room";
    public static final String MAIN_ROOM_ON_UPS = "SeaWulf Main Room on UPS";
    public static final String MAIN_ROOM_ON_NON_UPS = "SeaWulf Main Room on Non-UPS";
    public static final String ANNEX_ON_UPS = "SeaWulf Annex on UPS";
    public static final String ANNEX_ON_NON_UPS = "SeaWulf Annex on Non-UPS";
    public static final String ANNEX_TOTAL = "Com Center Annex Total";

    /** UPS trendlog output, in kW. */
    public static final String UPS_CHANNEL = "UPS_AVG";
    /** Enterprise aisle load, in kW. */
    public static final String ENT_CHANNEL = "ENT_AVG";

    /**
     * Selection categories.
     */
    public enum Category {
        A_SERIES("A-series PDUs",
                "PDU-A10-1", "PDU-A10-2", "PDU-A10-3",
                "PDU-A4-1", "PDU-A4-2",
                "PDU-A5-1", "PDU-A5-2", "PDU-A5-3", "PDU-A5-4", "PDU-A5-5",
                "PDU-A6-1", "PDU-A6-2", "PDU-A6-3",
                "PDU-A7-1", "PDU-A7-2", "PDU-A7-3",
                "PDU-A8-1", "PDU-A8-2", "PDU-A8-3", "PDU-A8-4"),
        B_SERIES("B-series PDUs",
                "PDU-B1-1", "PDU-B1-2", "PDU-B1-3",
                "PDU-B2-1", "PDU-B2-2",
                "PDU-B3-1", "PDU-B3-2", "PDU-B3-3", "PDU-B3-4",
                "PDU-B4-1", "PDU-B4-2"),
        D_SERIES("D-series PDUs",
                "PDU-D1-1", "PDU-D1-2", "PDU-D1-3", "PDU-D1-4",
                "PDU-D2-1", "PDU-D2-2", "PDU-D2-3", "PDU-D2-4",
                "PDU-D3-1", "PDU-D3-2", "PDU-D3-3", "PDU-D3-4",
                "PDU-D4-1", "PDU-D4-2", "PDU-D4-3", "PDU-D4-4",
                "PDU-D5-1", "PDU-D5-2", "PDU-D5-3"),
        OTHER_RACK_UNITS("Other rack power units",
                "UPS-PDU1", "UPS-PDU2",
                "SW-EPS1", "SW-EPS2", "SW-EPS3",
                "PDU-A0-1", "PDU-A0-2", "PDU-A0-3",
                "PDU-C4-1", "PDU-C4-2"),
        FACILITY_AGGREGATES("Facility level aggregates",
                MAIN_ROOM, "Com Center A-Aisle", "Com Center B-Aisle",
                MAIN_ROOM_ON_UPS, MAIN_ROOM_ON_NON_UPS,
                ANNEX_ON_UPS, ANNEX_ON_NON_UPS,
                ANNEX_TOTAL,
                "IACS Total", "IACS Main Panel", "IACS RP2 Panel");

        private final String displayName;
        private final List<String> channels;

        Category(String displayName, String... channels) {
            this.displayName = displayName;
            this.channels = List.of(channels);
        }

        public String getDisplayName() {
            return displayName;
        }

        public List<String> getChannels() {
            return channels;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    private static final List<String> ALL_CHANNELS = collectAll();

    private ChannelCatalog() {
    }

    public static boolean isKnown(String channel) {
        return ALL_CHANNELS.contains(channel);
    }

    public static boolean isMainRoom(String group) {
        return MAIN_ROOM.equals(group);
    }

    private static List<String> collectAll() {
        List<String> all = new ArrayList<>();
        Arrays.stream(Category.values()).forEach(category -> all.addAll(category.getChannels()));
        return Collections.unmodifiableList(all);
    }
}
