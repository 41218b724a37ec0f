package org.carball.sift.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads a YAML configuration file. A missing file falls back to defaults; a file that
     * cannot be parsed is a configuration error.
     */
    public SiftConfig loadConfigFile(Path configFile) {
        if (configFile == null) {
            log.info("No configuration file provided, using defaults");
            return SiftConfig.defaults();
        }

        if (!Files.exists(configFile)) {
            log.warn("Configuration file not found: {}, using defaults", configFile);
            return SiftConfig.defaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            SiftConfig config = mapper.readValue(configFile.toFile(), SiftConfig.class);
            log.info("Loaded configuration from {}: {}", configFile, config.getDescription());
            return config;
        } catch (IOException e) {
            log.error("Failed to load configuration from {}: {}", configFile, e.getMessage());
            throw new IllegalArgumentException("Invalid configuration file " + configFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads thresholds using the hierarchy: CLI args > env vars > defaults
     */
    public DecisionThresholds loadConfiguration(String[] args) {
        return loadConfiguration(SiftConfig.defaults(), null, args);
    }

    /**
     * Loads thresholds using the hierarchy: CLI args > env vars > profile > config file.
     */
    public DecisionThresholds loadConfiguration(SiftConfig fileConfig, String profileName, String[] args) {
        log.debug("Loading configuration");

        DecisionThresholds base = fileConfig.toThresholds();
        if (profileName != null) {
            base = loadProfile(profileName, base);
        }

        DecisionThresholds.DecisionThresholdsBuilder builder = base.toBuilder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        DecisionThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Loads a profile and applies env var and CLI overrides on top of it.
     */
    public DecisionThresholds loadConfigurationWithProfile(String profileName, String[] args) {
        return loadConfiguration(SiftConfig.defaults(), profileName, args);
    }

    /**
     * Loads thresholds from a specific profile.
     */
    public DecisionThresholds loadProfile(String profileName) {
        return loadProfile(profileName, DecisionThresholds.defaults());
    }

    private DecisionThresholds loadProfile(String profileName, DecisionThresholds base) {
        try {
            StorageProfile profile = StorageProfile.fromName(profileName);
            DecisionThresholds thresholds = profile.applyTo(base);
            log.info("Loaded profile '{}': {}", profileName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    private void applyEnvironmentVariables(DecisionThresholds.DecisionThresholdsBuilder builder) {
        try {
            if (environment.containsKey("SIFT_SQL_CONSISTENCY_THRESHOLD")) {
                builder.sqlConsistencyThreshold(Double.parseDouble(environment.get("SIFT_SQL_CONSISTENCY_THRESHOLD")));
            }
            if (environment.containsKey("SIFT_SQL_MAX_NESTING_DEPTH")) {
                builder.sqlMaxNestingDepth(Integer.parseInt(environment.get("SIFT_SQL_MAX_NESTING_DEPTH")));
            }
            if (environment.containsKey("SIFT_SQL_MAX_FIELD_COUNT")) {
                builder.sqlMaxFieldCount(Integer.parseInt(environment.get("SIFT_SQL_MAX_FIELD_COUNT")));
            }
            if (environment.containsKey("SIFT_MAX_ANALYSIS_DEPTH")) {
                builder.maxAnalysisDepth(Integer.parseInt(environment.get("SIFT_MAX_ANALYSIS_DEPTH")));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value in SIFT_* environment variable: " + e.getMessage(), e);
        }
    }

    private void applyCLIArguments(DecisionThresholds.DecisionThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.consistency":
                        builder.sqlConsistencyThreshold(Double.parseDouble(value));
                        break;
                    case "--thresholds.max-depth":
                        builder.sqlMaxNestingDepth(Integer.parseInt(value));
                        break;
                    case "--thresholds.max-fields":
                        builder.sqlMaxFieldCount(Integer.parseInt(value));
                        break;
                    case "--thresholds.analysis-ceiling":
                        builder.maxAnalysisDepth(Integer.parseInt(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.consistency <num>      Minimum batch consistency for SQL (0.0-1.0)
              --thresholds.max-depth <num>        Maximum nesting depth for SQL
              --thresholds.max-fields <num>       Maximum distinct field paths for SQL
              --thresholds.analysis-ceiling <num> Nesting depth at which payloads are rejected

            Environment Variables:
              SIFT_SQL_CONSISTENCY_THRESHOLD      Same as --thresholds.consistency
              SIFT_SQL_MAX_NESTING_DEPTH          Same as --thresholds.max-depth
              SIFT_SQL_MAX_FIELD_COUNT            Same as --thresholds.max-fields
              SIFT_MAX_ANALYSIS_DEPTH             Same as --thresholds.analysis-ceiling

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Profile (--profile)
              4. Configuration file (--config)
              5. Built-in defaults
            """;
    }
}
