package org.carball.sift.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    private ConfigurationLoader loader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(Map.of());
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        DecisionThresholds thresholds = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds.getSqlConsistencyThreshold()).isEqualTo(0.70);
        assertThat(thresholds.getSqlMaxNestingDepth()).isEqualTo(3);
        assertThat(thresholds.getSqlMaxFieldCount()).isEqualTo(50);
        assertThat(thresholds.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldLoadSpecificProfile() {
        // When
        DecisionThresholds thresholds = loader.loadProfile("document-first");

        // Then
        assertThat(thresholds.getSqlConsistencyThreshold()).isEqualTo(0.90);
        assertThat(thresholds.getSqlMaxNestingDepth()).isEqualTo(2);
        assertThat(thresholds.getProfileName()).isEqualTo("document-first");
    }

    @Test
    void shouldThrowExceptionForUnknownProfile() {
        // When/Then
        assertThatThrownBy(() -> loader.loadProfile("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown storage profile: nonexistent");
    }

    @Test
    void shouldApplyProfileWithOverrides() {
        // Given
        String[] args = {"--thresholds.max-depth", "6"};

        // When
        DecisionThresholds thresholds = loader.loadConfigurationWithProfile("relational-first", args);

        // Then - CLI > env vars > profile > defaults
        assertThat(thresholds.getSqlMaxNestingDepth()).isEqualTo(6); // CLI override
        assertThat(thresholds.getSqlConsistencyThreshold()).isEqualTo(0.50); // From profile
        assertThat(thresholds.getSqlMaxFieldCount()).isEqualTo(80); // From profile
        assertThat(thresholds.getProfileName()).isEqualTo("relational-first");
    }

    @Test
    void shouldParseCLIArguments() {
        // Given
        String[] args = {
                "--thresholds.consistency", "0.85",
                "--thresholds.max-depth", "2",
                "--thresholds.max-fields", "30",
                "--thresholds.analysis-ceiling", "16"
        };

        // When
        DecisionThresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getSqlConsistencyThreshold()).isEqualTo(0.85);
        assertThat(thresholds.getSqlMaxNestingDepth()).isEqualTo(2);
        assertThat(thresholds.getSqlMaxFieldCount()).isEqualTo(30);
        assertThat(thresholds.getMaxAnalysisDepth()).isEqualTo(16);
    }

    @Test
    void shouldIgnoreInvalidCLINumbers() {
        // Given
        String[] args = {"--thresholds.max-fields", "lots"};

        // When
        DecisionThresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getSqlMaxFieldCount()).isEqualTo(50);
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "SIFT_SQL_CONSISTENCY_THRESHOLD", "0.6",
                "SIFT_SQL_MAX_FIELD_COUNT", "10"));

        // When
        DecisionThresholds thresholds = envLoader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds.getSqlConsistencyThreshold()).isEqualTo(0.6);
        assertThat(thresholds.getSqlMaxFieldCount()).isEqualTo(10);
        assertThat(thresholds.getSqlMaxNestingDepth()).isEqualTo(3);
    }

    @Test
    void cliArgumentsShouldOverrideEnvironment() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("SIFT_SQL_MAX_FIELD_COUNT", "10"));

        // When
        DecisionThresholds thresholds = envLoader.loadConfiguration(new String[]{"--thresholds.max-fields", "20"});

        // Then
        assertThat(thresholds.getSqlMaxFieldCount()).isEqualTo(20);
    }

    @Test
    void shouldRejectInvalidEnvironmentNumbers() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("SIFT_SQL_MAX_NESTING_DEPTH", "deep"));

        // When/Then
        assertThatThrownBy(() -> envLoader.loadConfiguration(new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SIFT_");
    }

    @Test
    void shouldLoadYamlConfigFile() throws URISyntaxException {
        // Given
        Path file = Paths.get(getClass().getResource("/sift-test.yml").toURI());

        // When
        SiftConfig config = loader.loadConfigFile(file);

        // Then
        assertThat(config.getSqlConsistencyThreshold()).isEqualTo(0.8);
        assertThat(config.getSqlMaxNestingDepth()).isEqualTo(2);
        assertThat(config.getSqlMaxFieldCount()).isEqualTo(20);
        assertThat(config.getMaxIdentifierLength()).isEqualTo(40);
        assertThat(config.getBackendApplyMaxAttempts()).isEqualTo(5);
        assertThat(config.getBackendApplyBackoffMs()).isEqualTo(100); // Not in file
        assertThat(config.getMediaCategoryConfidenceFloor()).isEqualTo(0.35);
        assertThat(config.getCategoryVocabulary()).containsExactly("animals", "food", "travel");
        assertThat(config.getLabelToCategoryMap()).containsOnly(
                Map.entry("tabby", "animals"), Map.entry("pizza", "food"));
    }

    @Test
    void shouldFallBackToDefaultsForMissingFile() {
        // When
        SiftConfig config = loader.loadConfigFile(tempDir.resolve("absent.yml"));

        // Then
        assertThat(config).isEqualTo(SiftConfig.defaults());
        assertThat(loader.loadConfigFile(null)).isEqualTo(SiftConfig.defaults());
    }

    @Test
    void shouldRejectMalformedConfigFile() throws IOException {
        // Given
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "sql_max_nesting_depth: [oops\n");

        // When/Then
        assertThatThrownBy(() -> loader.loadConfigFile(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid configuration file");
    }

    @Test
    void profileShouldOverrideConfigFile() throws URISyntaxException {
        // Given
        SiftConfig fileConfig = loader.loadConfigFile(Paths.get(getClass().getResource("/sift-test.yml").toURI()));

        // When
        DecisionThresholds fromFile = loader.loadConfiguration(fileConfig, null, new String[0]);
        DecisionThresholds withProfile = loader.loadConfiguration(fileConfig, "balanced", new String[0]);

        // Then
        assertThat(fromFile.getSqlConsistencyThreshold()).isEqualTo(0.8);
        assertThat(fromFile.getSqlMaxNestingDepth()).isEqualTo(2);
        assertThat(withProfile.getSqlConsistencyThreshold()).isEqualTo(0.70);
        assertThat(withProfile.getSqlMaxNestingDepth()).isEqualTo(3);
    }

    @Test
    void shouldDescribeThresholdOptions() {
        assertThat(ConfigurationLoader.getThresholdHelp())
                .contains("--thresholds.consistency", "SIFT_SQL_MAX_FIELD_COUNT", "Priority Order");
    }
}
