package org.powerchart.correction;

/**
 * Fixed physical loads, in kW, that are not visible in the metered channels.
 */
public enum LoadConstant {
    /** Annex UPS load used while the annex was not metered. */
    ANNEX_UPS_BASELINE(6.857),
    /** PDU A0-3 while it was not metered. */
    PDU_A03(0.794),
    /** FSA plus Siemens equipment on the annex non-UPS feed. */
    ANNEX_NON_UPS(0.523 + 1.524),
    /** SCGP rack. */
    SCGP_RACK(1.248);

    private final double kilowatts;

    LoadConstant(double kilowatts) {
        this.kilowatts = kilowatts;
    }

    public double kilowatts() {
        return kilowatts;
    }
}
