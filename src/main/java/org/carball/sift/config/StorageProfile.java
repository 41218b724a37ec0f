package org.carball.sift.config;

import lombok.Getter;

@Getter
public enum StorageProfile {

    BALANCED("balanced", "Balanced routing - default thresholds for mixed workloads",
            0.70, 3, 50),

    RELATIONAL_FIRST("relational-first", "Prefer SQL tables - tolerate looser and deeper payloads",
            0.50, 4, 80),

    DOCUMENT_FIRST("document-first", "Prefer document collections - only very regular, flat payloads go to SQL",
            0.90, 2, 25);

    private final String name;
    private final String description;
    private final double consistencyThreshold;
    private final int maxNestingDepth;
    private final int maxFieldCount;

    StorageProfile(String name, String description,
                   double consistencyThreshold, int maxNestingDepth, int maxFieldCount) {
        this.name = name;
        this.description = description;
        this.consistencyThreshold = consistencyThreshold;
        this.maxNestingDepth = maxNestingDepth;
        this.maxFieldCount = maxFieldCount;
    }

    /**
     * Creates DecisionThresholds based on this profile's settings.
     */
    public DecisionThresholds buildThresholds() {
        return applyTo(DecisionThresholds.defaults());
    }

    /**
     * Overlays this profile's routing values on an existing configuration, keeping its
     * analysis ceiling.
     */
    public DecisionThresholds applyTo(DecisionThresholds base) {
        return base.toBuilder()
                .profileName(name)
                .profileDescription(description)
                .sqlConsistencyThreshold(consistencyThreshold)
                .sqlMaxNestingDepth(maxNestingDepth)
                .sqlMaxFieldCount(maxFieldCount)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static StorageProfile fromName(String name) {
        for (StorageProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown storage profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (StorageProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Storage Profiles:\n\n");
        for (StorageProfile profile : values()) {
            help.append(String.format("  %-20s %s%n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}
