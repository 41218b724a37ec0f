package org.carball.sift.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

@Value
@Builder(toBuilder = true)
@Slf4j
public class DecisionThresholds {

    // Storage routing policy
    @Builder.Default
    double sqlConsistencyThreshold = 0.70;

    @Builder.Default
    int sqlMaxNestingDepth = 3;

    @Builder.Default
    int sqlMaxFieldCount = 50;

    // Hard ceiling for recursive analysis and schema construction
    @Builder.Default
    int maxAnalysisDepth = 32;

    // Profile information
    @Builder.Default
    String profileName = "default";

    @Builder.Default
    String profileDescription = "Default routing thresholds";

    /**
     * Creates the default routing policy: consistency 0.70, depth 3, 50 fields.
     */
    public static DecisionThresholds defaults() {
        return DecisionThresholds.builder().build();
    }

    /**
     * Validates the threshold configuration and logs warnings for values that make one
     * backend unreachable.
     */
    public void validate() {
        if (sqlConsistencyThreshold < 0.0 || sqlConsistencyThreshold > 1.0) {
            log.warn("SQL consistency threshold ({}) should be between 0.0 and 1.0", sqlConsistencyThreshold);
        }

        if (sqlMaxNestingDepth < 1) {
            log.warn("SQL max nesting depth ({}) should be at least 1", sqlMaxNestingDepth);
        }

        if (sqlMaxFieldCount < 1) {
            log.warn("SQL max field count ({}) should be positive", sqlMaxFieldCount);
        }

        if (maxAnalysisDepth <= sqlMaxNestingDepth) {
            log.warn("Max analysis depth ({}) should be greater than SQL max nesting depth ({})",
                    maxAnalysisDepth, sqlMaxNestingDepth);
        }

        log.debug("Using thresholds - Consistency: {}, Depth: {}, Fields: {}, Profile: {}",
                sqlConsistencyThreshold, sqlMaxNestingDepth, sqlMaxFieldCount, profileName);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Consistency >= %.2f | Depth <= %d | Fields <= %d | Analysis ceiling: %d",
                profileName, sqlConsistencyThreshold, sqlMaxNestingDepth, sqlMaxFieldCount, maxAnalysisDepth);
    }
}
