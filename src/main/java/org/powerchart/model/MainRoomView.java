package org.powerchart.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Section of the Computing Center main room whose load is charted.
 */
public enum MainRoomView {
    WHOLE("whole", "Total", "Whole room, total"),
    UPS_ONLY("ups", "UPS", "UPS data-only"),
    ENTERPRISE_ONLY("ent", "ENT", "Enterprise aisle-only"),
    HPC_ONLY("hpc", "HPC", "HPC data-only"),
    NONMETERED("nonmetered", "Nonmetered", "Nonmetered equipment");

    private final String option;
    private final String header;
    private final String description;

    MainRoomView(String option, String header, String description) {
        this.option = option;
        this.header = header;
        this.description = description;
    }

    public String getOption() {
        return option;
    }

    /**
     * Suffix used in the chart title.
     */
    public String getHeader() {
        return header;
    }

    public String getDescription() {
        return description;
    }

    public boolean needsUps() {
        return this != HPC_ONLY && this != ENTERPRISE_ONLY;
    }

    public boolean needsEnterprise() {
        return this != HPC_ONLY && this != UPS_ONLY;
    }

    public boolean needsAnnex() {
        return this == WHOLE || this == NONMETERED;
    }

    public static Optional<MainRoomView> fromOption(String option) {
        if (option == null) {
            return Optional.empty();
        }
        String normalized = option.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(view -> view.option.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return description;
    }
}
