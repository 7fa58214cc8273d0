package org.powerchart.correction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Load constants in effect from {@code effectiveFrom} (epoch seconds) until the next entry.
 */
public record CorrectionEntry(long effectiveFrom, Map<LoadConstant, Double> constants) {

    public CorrectionEntry {
        Objects.requireNonNull(constants, "constants");
        constants = constants.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(constants));
    }

    public static CorrectionEntry of(long effectiveFrom, LoadConstant... loads) {
        Map<LoadConstant, Double> constants = new EnumMap<>(LoadConstant.class);
        for (LoadConstant load : loads) {
            constants.put(load, load.kilowatts());
        }
        return new CorrectionEntry(effectiveFrom, constants);
    }

    public double get(LoadConstant constant) {
        return constants.getOrDefault(constant, 0.0);
    }

    public boolean has(LoadConstant constant) {
        return constants.containsKey(constant);
    }

    /**
     * The annex is metered once the baseline constant no longer applies.
     */
    public boolean isAnnexMetered() {
        return !has(LoadConstant.ANNEX_UPS_BASELINE);
    }

    /**
     * Annex UPS load subtracted from the main room feed.
     */
    public double mainRoomAnnexUps(double meteredAnnexUps) {
        if (!isAnnexMetered()) {
            return get(LoadConstant.ANNEX_UPS_BASELINE);
        }
        return meteredAnnexUps + get(LoadConstant.SCGP_RACK) + get(LoadConstant.PDU_A03);
    }

    /**
     * Whole annex load derived from the annex total channel.
     */
    public double annexTotal(double meteredAnnexTotal) {
        if (!isAnnexMetered()) {
            return get(LoadConstant.ANNEX_UPS_BASELINE);
        }
        return meteredAnnexTotal + get(LoadConstant.PDU_A03)
                + get(LoadConstant.ANNEX_NON_UPS) + get(LoadConstant.SCGP_RACK);
    }

    /**
     * Annex UPS load derived from the annex UPS channel alone.
     */
    public double annexUpsOnly(double meteredAnnexUps) {
        if (!isAnnexMetered()) {
            return get(LoadConstant.ANNEX_UPS_BASELINE);
        }
        return meteredAnnexUps + get(LoadConstant.PDU_A03);
    }
}
