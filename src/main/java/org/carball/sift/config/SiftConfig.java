package org.carball.sift.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File-level configuration, bound from YAML with snake_case keys. Anything missing from
 * the file keeps the default declared here.
 */
@Data
public class SiftConfig {

    // Storage routing policy
    @JsonProperty("sql_consistency_threshold")
    private double sqlConsistencyThreshold = 0.70;

    @JsonProperty("sql_max_nesting_depth")
    private int sqlMaxNestingDepth = 3;

    @JsonProperty("sql_max_field_count")
    private int sqlMaxFieldCount = 50;

    @JsonProperty("max_analysis_depth")
    private int maxAnalysisDepth = 32;

    // Schema synthesis
    @JsonProperty("max_identifier_length")
    private int maxIdentifierLength = 63;

    // Backend retries
    @JsonProperty("backend_apply_max_attempts")
    private int backendApplyMaxAttempts = 3;

    @JsonProperty("backend_apply_backoff_ms")
    private long backendApplyBackoffMs = 100;

    // Media categorisation
    @JsonProperty("media_category_confidence_floor")
    private double mediaCategoryConfidenceFloor = 0.20;

    @JsonProperty("category_vocabulary")
    private List<String> categoryVocabulary = new ArrayList<>(List.of(
            "nature", "animals", "people", "architecture", "food",
            "vehicles", "technology", "art", "sports", "travel",
            "business", "medical", "education", "entertainment", "other"));

    @JsonProperty("label_to_category_map")
    private Map<String, String> labelToCategoryMap = defaultLabelMap();

    public static SiftConfig defaults() {
        return new SiftConfig();
    }

    public DecisionThresholds toThresholds() {
        return DecisionThresholds.builder()
                .sqlConsistencyThreshold(sqlConsistencyThreshold)
                .sqlMaxNestingDepth(sqlMaxNestingDepth)
                .sqlMaxFieldCount(sqlMaxFieldCount)
                .maxAnalysisDepth(maxAnalysisDepth)
                .build();
    }

    public String getDescription() {
        return String.format(
                "Config: consistency=%.2f, depth=%d, fields=%d, ceiling=%d, identifiers=%d, " +
                "applyAttempts=%d, backoffMs=%d, confidenceFloor=%.2f, categories=%d, labels=%d",
                sqlConsistencyThreshold,
                sqlMaxNestingDepth,
                sqlMaxFieldCount,
                maxAnalysisDepth,
                maxIdentifierLength,
                backendApplyMaxAttempts,
                backendApplyBackoffMs,
                mediaCategoryConfidenceFloor,
                categoryVocabulary.size(),
                labelToCategoryMap.size()
        );
    }

    private static Map<String, String> defaultLabelMap() {
        Map<String, String> labels = new LinkedHashMap<>();
        // animals
        labels.put("tabby", "animals");
        labels.put("tiger cat", "animals");
        labels.put("egyptian cat", "animals");
        labels.put("golden retriever", "animals");
        labels.put("labrador retriever", "animals");
        labels.put("german shepherd", "animals");
        labels.put("goldfish", "animals");
        labels.put("bald eagle", "animals");
        labels.put("zebra", "animals");
        labels.put("african elephant", "animals");
        // nature
        labels.put("alp", "nature");
        labels.put("volcano", "nature");
        labels.put("valley", "nature");
        labels.put("lakeside", "nature");
        labels.put("seashore", "nature");
        labels.put("cliff", "nature");
        labels.put("daisy", "nature");
        // people
        labels.put("groom", "people");
        labels.put("scuba diver", "people");
        labels.put("ballplayer", "sports");
        // architecture
        labels.put("church", "architecture");
        labels.put("castle", "architecture");
        labels.put("palace", "architecture");
        labels.put("suspension bridge", "architecture");
        labels.put("monastery", "architecture");
        // food
        labels.put("pizza", "food");
        labels.put("cheeseburger", "food");
        labels.put("hotdog", "food");
        labels.put("ice cream", "food");
        labels.put("espresso", "food");
        labels.put("banana", "food");
        // vehicles
        labels.put("sports car", "vehicles");
        labels.put("convertible", "vehicles");
        labels.put("pickup", "vehicles");
        labels.put("airliner", "vehicles");
        labels.put("mountain bike", "vehicles");
        labels.put("steam locomotive", "vehicles");
        // technology
        labels.put("laptop", "technology");
        labels.put("desktop computer", "technology");
        labels.put("cellular telephone", "technology");
        labels.put("monitor", "technology");
        // sports
        labels.put("soccer ball", "sports");
        labels.put("tennis ball", "sports");
        labels.put("basketball", "sports");
        // art
        labels.put("comic book", "art");
        labels.put("jigsaw puzzle", "entertainment");
        // medical
        labels.put("stethoscope", "medical");
        labels.put("syringe", "medical");
        // education
        labels.put("library", "education");
        labels.put("blackboard", "education");
        return labels;
    }
}
