package org.powerchart.correction;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Date-dependent load constants.
 *
 * <p>Entries are ordered by {@link CorrectionEntry#effectiveFrom()}. A lookup returns the latest
 * entry that is already in effect; timestamps before every entry get the baseline set.</p>
 */
public final class CorrectionTable {

    /** 2024-02-16 00:05:06 EST: the annex UPS becomes metered. */
    public static final long ANNEX_METERED_FROM = 1708059906L;

    /** 2024-03-13 00:00:06 EDT: PDU A0-3 becomes metered. */
    public static final long PDU_A03_METERED_FROM = 1710302406L;

    private static final CorrectionTable STANDARD = new CorrectionTable(
            CorrectionEntry.of(Long.MIN_VALUE, LoadConstant.ANNEX_UPS_BASELINE),
            List.of(
                    CorrectionEntry.of(ANNEX_METERED_FROM,
                            LoadConstant.PDU_A03, LoadConstant.ANNEX_NON_UPS, LoadConstant.SCGP_RACK),
                    CorrectionEntry.of(PDU_A03_METERED_FROM,
                            LoadConstant.ANNEX_NON_UPS, LoadConstant.SCGP_RACK)));

    private final CorrectionEntry baseline;
    private final List<CorrectionEntry> cutovers;

    public CorrectionTable(CorrectionEntry baseline, List<CorrectionEntry> cutovers) {
        this.baseline = Objects.requireNonNull(baseline, "baseline");
        this.cutovers = cutovers.stream()
                .sorted(Comparator.comparingLong(CorrectionEntry::effectiveFrom))
                .toList();
    }

    public static CorrectionTable standard() {
        return STANDARD;
    }

    public CorrectionEntry lookup(long epochSecond) {
        CorrectionEntry current = baseline;
        for (CorrectionEntry entry : cutovers) {
            if (entry.effectiveFrom() > epochSecond) {
                break;
            }
            current = entry;
        }
        return current;
    }

    public List<CorrectionEntry> getCutovers() {
        return cutovers;
    }

    public CorrectionEntry getBaseline() {
        return baseline;
    }
}
