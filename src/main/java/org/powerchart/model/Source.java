package org.powerchart.model;

/**
 * Origin of a dataset.
 */
public enum Source {
    HPC("HPC polling"),
    UPS("UPS trendlog"),
    ENT("Enterprise aisle");

    private final String displayName;

    Source(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
