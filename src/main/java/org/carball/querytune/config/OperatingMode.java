package org.carball.querytune.config;

import lombok.Getter;

/**
 * Workload profile that decides how index priority factors are weighted.
 */
@Getter
public enum OperatingMode {

    BALANCED("balanced", "Default weights for mixed workloads", false, false, false),

    READ_HEAVY("read-heavy", "Favour query speed-up and frequency over write cost", true, false, false),

    WRITE_HEAVY("write-heavy", "Penalise write-path maintenance cost", false, true, false),

    STORAGE_CONSTRAINED("storage-constrained", "Penalise maintenance cost and index complexity", false, false, true);

    private final String name;
    private final String description;
    private final boolean readHeavy;
    private final boolean writeHeavy;
    private final boolean storageConstrained;

    OperatingMode(String name, String description,
                  boolean readHeavy, boolean writeHeavy, boolean storageConstrained) {
        this.name = name;
        this.description = description;
        this.readHeavy = readHeavy;
        this.writeHeavy = writeHeavy;
        this.storageConstrained = storageConstrained;
    }

    /**
     * Finds a mode by name (case-insensitive).
     */
    public static OperatingMode fromName(String name) {
        for (OperatingMode mode : values()) {
            if (mode.getName().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown operating mode: " + name +
                ". Available modes: " + getAvailableModes());
    }

    public static String getAvailableModes() {
        StringBuilder sb = new StringBuilder();
        for (OperatingMode mode : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(mode.getName());
        }
        return sb.toString();
    }

    public static String getModeHelp() {
        StringBuilder help = new StringBuilder("Available Operating Modes:\n\n");
        for (OperatingMode mode : values()) {
            help.append(String.format("  %-20s %s\n", mode.getName(), mode.getDescription()));
        }
        help.append("\nUse --mode <name> to select a mode.\n");
        return help.toString();
    }
}
