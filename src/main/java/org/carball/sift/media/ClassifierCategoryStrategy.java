package org.carball.sift.media;

import lombok.extern.slf4j.Slf4j;
import org.carball.sift.model.media.Classification;

import java.io.IOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the classifier for a label and maps it onto the category vocabulary. Classifier
 * failures and low-confidence answers yield nothing.
 */
@Slf4j
public class ClassifierCategoryStrategy implements CategoryStrategy {

    private final MediaClassifier classifier;
    private final double confidenceFloor;
    private final Map<String, String> labelToCategory;
    private final KeywordCategoryMatcher vocabulary;

    public ClassifierCategoryStrategy(MediaClassifier classifier,
                                      double confidenceFloor,
                                      Map<String, String> labelToCategory,
                                      KeywordCategoryMatcher vocabulary) {
        this.classifier = classifier;
        this.confidenceFloor = confidenceFloor;
        this.labelToCategory = new HashMap<>();
        labelToCategory.forEach((label, category) ->
                this.labelToCategory.put(label.trim().toLowerCase(Locale.ROOT), category));
        this.vocabulary = vocabulary;
    }

    @Override
    public String getName() {
        return "classifier";
    }

    @Override
    public Optional<String> resolve(byte[] content, String filename) {
        Classification classification;
        try {
            classification = classifier.classify(content);
        } catch (IOException | RuntimeException e) {
            log.warn("Classifier failed for {}, falling back: {}", filename, e.getMessage());
            return Optional.empty();
        }

        if (classification == null || classification.label() == null) {
            return Optional.empty();
        }
        if (classification.confidence() < confidenceFloor) {
            log.debug("Classifier label '{}' for {} below confidence floor ({} < {})",
                    classification.label(), filename, classification.confidence(), confidenceFloor);
            return Optional.empty();
        }

        String label = classification.label().trim().toLowerCase(Locale.ROOT);
        String mapped = labelToCategory.get(label);
        if (mapped != null) {
            return Optional.of(mapped);
        }
        if (vocabulary.contains(label)) {
            return Optional.of(label);
        }
        log.debug("Classifier label '{}' for {} has no category mapping", label, filename);
        return Optional.empty();
    }
}
